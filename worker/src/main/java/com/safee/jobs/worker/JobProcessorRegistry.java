package com.safee.jobs.worker;

import com.safee.jobs.store.JobName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

public class JobProcessorRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobProcessorRegistry.class);

    private final Map<JobName, JobProcessor> processors = new EnumMap<>(JobName.class);

    /** Registry of every processor on the classpath. */
    public static JobProcessorRegistry loadInstalled() {
        JobProcessorRegistry registry = new JobProcessorRegistry();
        for (JobProcessor processor : ServiceLoader.load(JobProcessor.class)) {
            registry.register(processor);
        }
        log.info("Loaded job processors for {}", registry.jobNames());
        return registry;
    }

    /**
     * @throws IllegalArgumentException when the job name already has a processor
     */
    public synchronized JobProcessorRegistry register(JobProcessor processor) {
        JobName name = processor.jobName();
        if (name == null) {
            throw new IllegalArgumentException("processor " + processor.getClass().getName() + " has no job name");
        }
        JobProcessor existing = processors.putIfAbsent(name, processor);
        if (existing != null) {
            throw new IllegalArgumentException("duplicate processor for " + name + ": "
                    + existing.getClass().getName() + " and " + processor.getClass().getName());
        }
        return this;
    }

    public synchronized Optional<JobProcessor> find(JobName jobName) {
        return Optional.ofNullable(processors.get(jobName));
    }

    public synchronized Set<JobName> jobNames() {
        return Set.copyOf(processors.keySet());
    }
}
