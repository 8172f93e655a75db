package com.purchasingpower.genki.exception;

import lombok.Getter;

@Getter
public class BotAccountRejectedException extends RuntimeException {

    private final String username;

    public BotAccountRejectedException(String username) {
        super("Bot users are not supported: " + username);
        this.username = username;
    }
}
