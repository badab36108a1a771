package info.mouts.orderprocessing.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    /**
     * UTC clock used for order timestamps and the stats window. Hour buckets
     * are reported in UTC as well.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
