package com.aec.DriveSrv.service;

import com.aec.DriveSrv.exception.DriveProviderException;
import com.aec.DriveSrv.exception.UnauthenticatedException;
import com.aec.DriveSrv.model.UserAccount;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DriveCallRunnerTest {

    @Mock
    AccessTokenBroker broker;

    @InjectMocks
    DriveCallRunner runner;

    private final UserAccount user = UserAccount.builder().id("u1").build();

    @Test
    void successfulCallUsesCachedTokenOnly() {
        when(broker.obtain(user, false)).thenReturn("cached");

        String result = runner.run(user, token -> "listed with " + token);

        assertThat(result).isEqualTo("listed with cached");
        verify(broker, never()).obtain(any(UserAccount.class), eq(true));
    }

    @Test
    void unauthorizedTriggersOneForcedRefreshAndOneRetry() {
        when(broker.obtain(user, false)).thenReturn("revoked");
        when(broker.obtain(user, true)).thenReturn("fresh");
        List<String> attempts = new ArrayList<>();

        String result = runner.run(user, token -> {
            attempts.add(token);
            if (token.equals("revoked")) {
                throw new DriveProviderException(401, "invalid credentials", null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).containsExactly("revoked", "fresh");
        verify(broker).obtain(user, true);
    }

    @Test
    void secondUnauthorizedPropagates() {
        when(broker.obtain(user, false)).thenReturn("revoked");
        when(broker.obtain(user, true)).thenReturn("also-revoked");
        List<String> attempts = new ArrayList<>();

        assertThatThrownBy(() -> runner.run(user, token -> {
            attempts.add(token);
            throw new DriveProviderException(401, "invalid credentials", null);
        }))
                .isInstanceOf(DriveProviderException.class)
                .satisfies(e -> assertThat(((DriveProviderException) e).isUnauthorized()).isTrue());
        assertThat(attempts).hasSize(2);
    }

    @Test
    void otherProviderErrorsAreNotRetried() {
        when(broker.obtain(user, false)).thenReturn("cached");
        List<String> attempts = new ArrayList<>();

        assertThatThrownBy(() -> runner.run(user, token -> {
            attempts.add(token);
            throw new DriveProviderException(500, "backend error", null);
        })).isInstanceOf(DriveProviderException.class);

        assertThat(attempts).containsExactly("cached");
        verify(broker, never()).obtain(user, true);
    }

    @Test
    void failedForcedRefreshSurfacesAsUnauthenticated() {
        when(broker.obtain(user, false)).thenReturn("revoked");
        when(broker.obtain(user, true)).thenThrow(new UnauthenticatedException("Failed to refresh Google token"));

        assertThatThrownBy(() -> runner.run(user, token -> {
            throw new DriveProviderException(401, "invalid credentials", null);
        })).isInstanceOf(UnauthenticatedException.class);
    }

    @Test
    void brokerFailureBeforeCallSkipsTheCall() {
        when(broker.obtain(any(UserAccount.class), anyBoolean()))
                .thenThrow(new UnauthenticatedException("Session expired"));
        List<String> attempts = new ArrayList<>();

        assertThatThrownBy(() -> runner.run(user, token -> attempts.add(token)))
                .isInstanceOf(UnauthenticatedException.class);
        assertThat(attempts).isEmpty();
    }
}
