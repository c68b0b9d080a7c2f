package com.tickerwolf.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "intraday")
public class IntradayProperties {
    private String namespace = "intraday";
    /** {@code memory} or {@code jdbc}. */
    private String store = "memory";
    private int retentionDays = 5;
    private Prefetch prefetch = new Prefetch();

    @Getter
    @Setter
    public static class Prefetch {
        private int limit = 500;
    }
}
