package com.scholary.audiobook.export;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration for the ffmpeg encoder. */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @NotBlank String loudnormFilter,
    @Positive int stderrTailLines,
    @Positive int abortWaitSeconds) {}
