package com.snipebot.checkout;

/**
 * Hands a payment approval (3-D Secure) URL to the buyer.
 */
public interface ApprovalOpener {

    void open(String url);
}
