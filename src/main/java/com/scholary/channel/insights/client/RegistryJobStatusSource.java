package com.scholary.channel.insights.client;

import com.scholary.channel.insights.job.Job;
import com.scholary.channel.insights.job.JobRegistry;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Reads job snapshots straight from the in-process registry. */
@Component
public class RegistryJobStatusSource implements JobStatusSource {

  private final JobRegistry registry;

  public RegistryJobStatusSource(JobRegistry registry) {
    this.registry = registry;
  }

  @Override
  public Optional<Job> fetch(String jobId) {
    return registry.getJob(jobId);
  }
}
