package com.contact.resolution.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A contact record: the identity unit that channels, imports and CRM syncs create.
 *
 * <p>Instances are immutable. Changes are made by copying through {@link #builder(Contact)}
 * and saving the copy; the store bumps {@link #getVersion()} on every committed write.</p>
 */
public class Contact {
    private final String id;
    private final String firstName;
    private final String lastName;
    private final String email;
    private final String phone;
    private final String whatsapp;
    private final String company;
    private final String jobTitle;
    private final ContactStatus status;
    private final Set<String> tags;
    private final CustomFields customFields;
    private final Instant lastContactedAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    private Contact(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.firstName = builder.firstName;
        this.lastName = builder.lastName;
        this.email = builder.email;
        this.phone = builder.phone;
        this.whatsapp = builder.whatsapp;
        this.company = builder.company;
        this.jobTitle = builder.jobTitle;
        this.status = builder.status != null ? builder.status : ContactStatus.ACTIVE;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.customFields = builder.customFields != null ? builder.customFields : CustomFields.empty();
        this.lastContactedAt = builder.lastContactedAt;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.version = builder.version;
    }

    public String getId() {
        return id;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getWhatsapp() {
        return whatsapp;
    }

    public String getCompany() {
        return company;
    }

    public String getJobTitle() {
        return jobTitle;
    }

    public ContactStatus getStatus() {
        return status;
    }

    public Set<String> getTags() {
        return tags;
    }

    public CustomFields getCustomFields() {
        return customFields;
    }

    public Instant getLastContactedAt() {
        return lastContactedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    /**
     * The fields used for similarity scoring.
     */
    public IdentityTuple identity() {
        return new IdentityTuple(firstName, lastName, email, phone, company);
    }

    /**
     * Human readable name, falling back to email, then phone.
     */
    public String getDisplayName() {
        String name = ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
        if (!name.isEmpty()) {
            return name;
        }
        if (email != null && !email.isBlank()) {
            return email;
        }
        return phone != null ? phone : "Unknown";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Contact contact = (Contact) o;
        return Objects.equals(id, contact.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Contact{" +
                "id='" + id + '\'' +
                ", firstName='" + firstName + '\'' +
                ", lastName='" + lastName + '\'' +
                ", email='" + email + '\'' +
                ", phone='" + phone + '\'' +
                ", status=" + status +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Contact contact) {
        return new Builder()
                .id(contact.id)
                .firstName(contact.firstName)
                .lastName(contact.lastName)
                .email(contact.email)
                .phone(contact.phone)
                .whatsapp(contact.whatsapp)
                .company(contact.company)
                .jobTitle(contact.jobTitle)
                .status(contact.status)
                .tags(contact.tags)
                .customFields(contact.customFields)
                .lastContactedAt(contact.lastContactedAt)
                .createdAt(contact.createdAt)
                .updatedAt(contact.updatedAt)
                .version(contact.version);
    }

    public static class Builder {
        private String id;
        private String firstName;
        private String lastName;
        private String email;
        private String phone;
        private String whatsapp;
        private String company;
        private String jobTitle;
        private ContactStatus status;
        private final Set<String> tags = new LinkedHashSet<>();
        private CustomFields customFields;
        private Instant lastContactedAt;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder whatsapp(String whatsapp) {
            this.whatsapp = whatsapp;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder jobTitle(String jobTitle) {
            this.jobTitle = jobTitle;
            return this;
        }

        public Builder status(ContactStatus status) {
            this.status = status;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags.clear();
            if (tags != null) {
                tags.stream().filter(Objects::nonNull).forEach(this.tags::add);
            }
            return this;
        }

        public Builder tag(String tag) {
            if (tag != null) {
                this.tags.add(tag);
            }
            return this;
        }

        public Builder customFields(CustomFields customFields) {
            this.customFields = customFields;
            return this;
        }

        public Builder lastContactedAt(Instant lastContactedAt) {
            this.lastContactedAt = lastContactedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Contact build() {
            return new Contact(this);
        }
    }
}
