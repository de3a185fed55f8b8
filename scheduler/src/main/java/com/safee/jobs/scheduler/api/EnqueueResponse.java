package com.safee.jobs.scheduler.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.safee.jobs.store.Job;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnqueueResponse {
    private Job job;
    private String queueName;
    private String messageId;

    public EnqueueResponse() {
    }

    public EnqueueResponse(Job job, String queueName, String messageId) {
        this.job = job;
        this.queueName = queueName;
        this.messageId = messageId;
    }

    public Job getJob() {
        return job;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getMessageId() {
        return messageId;
    }
}
