package com.jobbus.client;

/**
 * Describes a failure raised while pumping a subscription.
 *
 * @param action what the receiver was doing, e.g. {@code UserCallback} or {@code Receive}
 */
public record ExceptionReceivedContext(Throwable exception, String entityPath, String action) {

    public static final String USER_CALLBACK = "UserCallback";
    public static final String RECEIVE = "Receive";
    public static final String COMPLETE = "Complete";
}
