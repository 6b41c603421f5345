package com.herzen.unlock.parser;

public class TokenParseException extends RuntimeException {
    private final String token;

    public TokenParseException(String token, String message) {
        super(message + ": '" + token + "'");
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
