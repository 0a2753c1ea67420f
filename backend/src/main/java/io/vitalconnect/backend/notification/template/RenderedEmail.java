package io.vitalconnect.backend.notification.template;

/** Output of template rendering, ready for the mail sender. */
public record RenderedEmail(String subject, String htmlBody, String plainTextBody) {}
