package com.churnmetrics.api.account.exceptions;

/**
 * Thrown when an account referenced by a request doesn't exist.
 */
public class AccountNotFoundException extends Exception {

    public AccountNotFoundException(long accountId) {
        super(String.format("account '%d' doesn't exist", accountId));
    }
}
