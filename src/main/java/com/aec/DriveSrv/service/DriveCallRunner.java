package com.aec.DriveSrv.service;

import com.aec.DriveSrv.exception.DriveProviderException;
import com.aec.DriveSrv.model.UserAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs a Drive call with the user's token. If Drive answers 401 the token is
 * force-refreshed and the call is repeated exactly once; a second 401, and every
 * other failure, propagates.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DriveCallRunner {

    private final AccessTokenBroker broker;

    @FunctionalInterface
    public interface DriveCall<T> {
        T execute(String accessToken);
    }

    public <T> T run(UserAccount user, DriveCall<T> call) {
        String accessToken = broker.obtain(user, false);
        try {
            return call.execute(accessToken);
        } catch (DriveProviderException e) {
            if (!e.isUnauthorized()) {
                throw e;
            }
            log.info("Drive rejected token for user {}; forcing refresh and retrying once", user.getId());
            String refreshed = broker.obtain(user, true);
            return call.execute(refreshed);
        }
    }
}
