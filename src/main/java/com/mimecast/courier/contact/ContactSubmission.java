package com.mimecast.courier.contact;

import java.util.Objects;

/**
 * Contact form submission.
 */
public final class ContactSubmission {
    private final String name;
    private final String email;
    private final String phone;
    private final String subject;
    private final String message;

    /**
     * Constructs a new ContactSubmission instance.
     *
     * @param name    Submitter name.
     * @param email   Submitter address.
     * @param phone   Submitter phone or null.
     * @param subject Subject.
     * @param message Message text.
     */
    public ContactSubmission(String name, String email, String phone, String subject, String message) {
        this.name = Objects.requireNonNull(name, "name");
        this.email = Objects.requireNonNull(email, "email");
        this.phone = phone != null ? phone : "";
        this.subject = Objects.requireNonNull(subject, "subject");
        this.message = Objects.requireNonNull(message, "message");
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }
}
