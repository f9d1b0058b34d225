package com.scholary.audiobook.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final JobRepository repository = new JobRepository(10, 60);

  @Test
  void getById_shouldReturnSavedJob() {
    SynthesisJob job = new SynthesisJob("job-1", null, 10);
    repository.save(job);

    assertThat(repository.getById("job-1")).isSameAs(job);
  }

  @Test
  void getById_shouldThrowForUnknownOrDeletedJob() {
    repository.save(new SynthesisJob("job-1", null, 10));
    repository.delete("job-1");

    assertThat(repository.findById("job-1")).isEmpty();
    assertThatThrownBy(() -> repository.getById("job-1"))
        .isInstanceOf(JobNotFoundException.class)
        .hasMessageContaining("job-1");
  }
}
