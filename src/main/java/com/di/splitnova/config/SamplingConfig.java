package com.di.splitnova.config;

import com.di.splitnova.sampling.ScalableSrsSampler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SamplingConfig {

    /** Source of default seeds; replaced in tests with a fixed clock. */
    @Bean
    public Clock samplingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScalableSrsSampler scalableSrsSampler(Clock samplingClock) {
        return new ScalableSrsSampler(samplingClock);
    }
}
