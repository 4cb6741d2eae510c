package com.contact.resolution.core.model;

import java.util.Locale;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Scalar identity fields of a contact that a merge resolves one by one.
 */
public enum ContactField {
    FIRST_NAME("firstName", Contact::getFirstName, Contact.Builder::firstName),
    LAST_NAME("lastName", Contact::getLastName, Contact.Builder::lastName),
    EMAIL("email", Contact::getEmail, Contact.Builder::email),
    PHONE("phone", Contact::getPhone, Contact.Builder::phone),
    WHATSAPP("whatsapp", Contact::getWhatsapp, Contact.Builder::whatsapp),
    COMPANY("company", Contact::getCompany, Contact.Builder::company),
    JOB_TITLE("jobTitle", Contact::getJobTitle, Contact.Builder::jobTitle);

    private final String fieldName;
    private final Function<Contact, String> getter;
    private final BiConsumer<Contact.Builder, String> setter;

    ContactField(String fieldName, Function<Contact, String> getter, BiConsumer<Contact.Builder, String> setter) {
        this.fieldName = fieldName;
        this.getter = getter;
        this.setter = setter;
    }

    public String fieldName() {
        return fieldName;
    }

    public String valueOf(Contact contact) {
        return getter.apply(contact);
    }

    public void apply(Contact.Builder builder, String value) {
        setter.accept(builder, value);
    }

    /**
     * Accepts the camelCase wire name ({@code jobTitle}) or the constant name ({@code JOB_TITLE}).
     */
    public static Optional<ContactField> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ContactField field : values()) {
            if (field.fieldName.equalsIgnoreCase(name) || field.name().equals(name.toUpperCase(Locale.ROOT))) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
