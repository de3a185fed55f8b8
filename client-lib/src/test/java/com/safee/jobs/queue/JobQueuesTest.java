package com.safee.jobs.queue;

import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Set;

import org.junit.Test;

import com.safee.jobs.store.JobName;

public class JobQueuesTest {

    @Test
    public void everyJobNameHasAQueue() {
        for (JobName name : JobName.values()) {
            assertThat(name + " routed", JobQueues.allQueues().contains(JobQueues.queueFor(name)), is(true));
        }
    }

    @Test
    public void emailKindsUseSeparateQueues() {
        assertThat(JobQueues.queueFor(JobName.SEND_EMAIL), is("email-jobs"));
        assertThat(JobQueues.queueFor(JobName.SEND_BULK_EMAIL), is("email"));
    }

    @Test
    public void encryptionQueueIsShared() {
        Set<JobName> names = JobQueues.jobNamesFor(JobQueues.ENCRYPTION);
        assertThat(names.size(), is(2));
        assertThat(names, hasItems(JobName.ENCRYPT_FILE, JobName.REENCRYPT_FILES));
        assertThat(JobQueues.queueFor(JobName.ROTATE_ENCRYPTION_KEY), is("key-rotation"));
    }

    @Test
    public void allQueuesHasNoDuplicates() {
        assertThat(JobQueues.allQueues().size(), is(9));
    }
}
