package com.dokanclient.core.auth;

import com.dokanclient.core.spi.Authenticator;
import com.dokanclient.exception.AuthenticationException;
import com.dokanclient.model.OutgoingRequest;
import com.dokanclient.model.enums.AuthType;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * 静态用户名/密码, Authorization: Basic base64(user:pass)
 */
public class BasicAuthenticator implements Authenticator {

    private final String username;

    private final String password;

    public BasicAuthenticator(String username, String password) {
        this.username = username;
        this.password = password;
    }

    @Override
    public void authenticate(OutgoingRequest.Builder request) {
        if (!isValid()) {
            throw new AuthenticationException("username and password are required for basic auth");
        }
        String raw = username + ":" + password;
        request.header("Authorization",
                "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public boolean isValid() {
        return username != null && !username.isEmpty()
                && password != null && !password.isEmpty();
    }

    @Override
    public void refresh() {
        // 静态凭证无需刷新
    }

    @Override
    public AuthType type() {
        return AuthType.BASIC;
    }

    @Override
    public String toString() {
        return "BasicAuthenticator{username=" + username + "}";
    }
}
