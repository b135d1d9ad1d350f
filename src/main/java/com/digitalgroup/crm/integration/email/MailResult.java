package com.digitalgroup.crm.integration.email;

/**
 * Outcome of one outbound message. Transport errors are reported here
 * instead of being thrown.
 */
public record MailResult(boolean success, String messageId, String message) {

    public static MailResult sent(String messageId) {
        return new MailResult(true, messageId, "Email sent");
    }

    public static MailResult failed(String message) {
        return new MailResult(false, null, message);
    }
}
