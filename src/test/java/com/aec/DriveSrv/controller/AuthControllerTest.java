package com.aec.DriveSrv.controller;

import com.aec.DriveSrv.exception.InvalidRequestException;
import com.aec.DriveSrv.model.UserAccount;
import com.aec.DriveSrv.service.GoogleLoginService;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AuthControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    GoogleLoginService login;

    @Test
    void loginRedirectsToConsentWithStateCookie() throws Exception {
        mvc.perform(get("/auth/google/login"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", allOf(
                        startsWith("https://accounts.google.com/o/oauth2/v2/auth"),
                        containsString("access_type=offline"),
                        containsString("prompt=consent"),
                        containsString("state="))))
                .andExpect(header().string("Set-Cookie", allOf(
                        startsWith("oauth_state="),
                        containsString("HttpOnly"),
                        containsString("SameSite=Lax"))));
    }

    @Test
    void callbackWithMismatchedStateIsRejected() throws Exception {
        mvc.perform(get("/auth/google/callback")
                        .param("code", "auth-code")
                        .param("state", "from-query")
                        .cookie(new Cookie("oauth_state", "from-cookie")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
        verify(login, never()).completeLogin(anyString());
    }

    @Test
    void callbackWithoutStateCookieIsRejected() throws Exception {
        mvc.perform(get("/auth/google/callback").param("code", "auth-code").param("state", "s"))
                .andExpect(status().isBadRequest());
        verify(login, never()).completeLogin(anyString());
    }

    @Test
    void consentErrorIsReported() throws Exception {
        mvc.perform(get("/auth/google/callback").param("error", "access_denied"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("access_denied")));
    }

    @Test
    void validCallbackIssuesSessionAndRedirectsToFrontend() throws Exception {
        when(login.completeLogin("auth-code"))
                .thenReturn(UserAccount.builder().id("google-sub-7").email("a@example.com").build());

        mvc.perform(get("/auth/google/callback")
                        .param("code", "auth-code")
                        .param("state", "same-state")
                        .cookie(new Cookie("oauth_state", "same-state")))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "http://localhost:3000/login/success"))
                .andExpect(header().stringValues("Set-Cookie", hasItem(allOf(
                        startsWith("session="), containsString("HttpOnly")))))
                .andExpect(header().stringValues("Set-Cookie", hasItem(allOf(
                        startsWith("oauth_state="), containsString("Max-Age=0")))));
    }

    @Test
    void rejectedCodeExchangeIsBadRequest() throws Exception {
        when(login.completeLogin("bad-code")).thenThrow(new InvalidRequestException("Token exchange failed: invalid_grant"));

        mvc.perform(get("/auth/google/callback")
                        .param("code", "bad-code")
                        .param("state", "s1")
                        .cookie(new Cookie("oauth_state", "s1")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("invalid_grant")));
    }
}
