package com.scholary.dialect.transcriber.config;

import com.scholary.dialect.transcriber.audio.AudioDecoder;
import com.scholary.dialect.transcriber.audio.AudioProperties;
import com.scholary.dialect.transcriber.audio.FfmpegAudioDecoder;
import com.scholary.dialect.transcriber.audio.FfmpegProperties;
import com.scholary.dialect.transcriber.audio.RoutingAudioDecoder;
import com.scholary.dialect.transcriber.audio.WavAudioDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for audio intake.
 *
 * <p>Loads {@link AudioProperties} and {@link FfmpegProperties} from application.yml and wires the
 * decoder chain: JDK-native containers are decoded in process, everything else through ffmpeg.
 */
@Configuration
@EnableConfigurationProperties({AudioProperties.class, FfmpegProperties.class})
public class AudioConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioConfig.class);

  @Bean
  public AudioDecoder audioDecoder(FfmpegProperties ffmpeg, PipelineProperties pipeline) {
    AudioDecoder ffmpegDecoder =
        ffmpeg.enabled() ? new FfmpegAudioDecoder(ffmpeg, pipeline.sampleRate()) : null;
    LOGGER.info(
        "Audio decoding: ffmpeg={}, binary={}, rate={}Hz",
        ffmpeg.enabled() ? "enabled" : "disabled",
        ffmpeg.binary(),
        pipeline.sampleRate());
    return new RoutingAudioDecoder(new WavAudioDecoder(), ffmpegDecoder);
  }
}
