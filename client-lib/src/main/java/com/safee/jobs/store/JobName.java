package com.safee.jobs.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Logical kind of work; routes a job to its queue and processor. */
public enum JobName {
    SEND_EMAIL("send_email"),
    SEND_BULK_EMAIL("send_bulk_email"),
    SYNC_ODOO("sync_odoo"),
    GENERATE_REPORT("generate_report"),
    CALCULATE_ANALYTICS("calculate_analytics"),
    ODOO_PROVISIONING("odoo_provisioning"),
    INSTALL_ODOO_MODULES("install_odoo_modules"),
    ENCRYPT_FILE("encrypt_file"),
    REENCRYPT_FILES("reencrypt_files"),
    ROTATE_ENCRYPTION_KEY("rotate_encryption_key");

    private final String value;

    JobName(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JobName fromValue(String value) {
        for (JobName candidate : values()) {
            if (candidate.value.equals(value)) {
                return candidate;
            }
        }
        throw new JobValidationException("Invalid job name: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
