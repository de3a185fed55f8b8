package com.safee.jobs.queue;

import com.safee.jobs.store.JobName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routing table from job name to queue name. Several job names may share a queue.
 */
public final class JobQueues {
    public static final String EMAIL_JOBS = "email-jobs";
    public static final String EMAIL = "email";
    public static final String ODOO_SYNC = "odoo-sync";
    public static final String REPORTS = "reports";
    public static final String ANALYTICS = "analytics";
    public static final String ODOO_PROVISIONING = "odoo-provisioning";
    public static final String INSTALL_MODULES = "install-modules";
    public static final String ENCRYPTION = "encryption";
    public static final String KEY_ROTATION = "key-rotation";

    private static final Map<JobName, String> ROUTES = new EnumMap<>(JobName.class);

    static {
        ROUTES.put(JobName.SEND_EMAIL, EMAIL_JOBS);
        ROUTES.put(JobName.SEND_BULK_EMAIL, EMAIL);
        ROUTES.put(JobName.SYNC_ODOO, ODOO_SYNC);
        ROUTES.put(JobName.GENERATE_REPORT, REPORTS);
        ROUTES.put(JobName.CALCULATE_ANALYTICS, ANALYTICS);
        ROUTES.put(JobName.ODOO_PROVISIONING, ODOO_PROVISIONING);
        ROUTES.put(JobName.INSTALL_ODOO_MODULES, INSTALL_MODULES);
        ROUTES.put(JobName.ENCRYPT_FILE, ENCRYPTION);
        ROUTES.put(JobName.REENCRYPT_FILES, ENCRYPTION);
        ROUTES.put(JobName.ROTATE_ENCRYPTION_KEY, KEY_ROTATION);
    }

    private JobQueues() {
    }

    public static String queueFor(JobName jobName) {
        String queue = ROUTES.get(jobName);
        if (queue == null) {
            throw new IllegalArgumentException("No queue configured for job name: " + jobName);
        }
        return queue;
    }

    /** Every queue name, in declaration order of the job names. */
    public static List<String> allQueues() {
        return Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(ROUTES.values())));
    }

    public static Set<JobName> jobNamesFor(String queueName) {
        Set<JobName> names = new LinkedHashSet<>();
        for (Map.Entry<JobName, String> e : ROUTES.entrySet()) {
            if (e.getValue().equals(queueName)) {
                names.add(e.getKey());
            }
        }
        return names;
    }
}
