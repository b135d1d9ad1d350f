package com.digitalgroup.crm.integration.email;

public record RenderedEmail(String subject, String html, String fromEmail, String fromName) {
}
