package com.elssolution.meterhistory.config;

import com.elssolution.meterhistory.integration.MetricsBackend;
import com.elssolution.meterhistory.integration.influx.ColumnarReadClient;
import com.elssolution.meterhistory.integration.influx.InfluxColumnarReadClient;
import com.elssolution.meterhistory.integration.influx.InfluxMetricsBackend;
import com.elssolution.meterhistory.integration.jdbc.SqliteMetricsBackend;
import com.elssolution.meterhistory.service.FieldAggregationPolicy;
import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.InfluxDBClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Picks the read backend once, at startup: {@code history.backend=relational} (default) or {@code columnar}.
 */
@Slf4j
@Configuration
public class BackendConfig {

    @Bean
    @ConditionalOnProperty(name = "history.backend", havingValue = "relational", matchIfMissing = true)
    public MetricsBackend relationalBackend(JdbcTemplate jdbc,
                                            FieldAggregationPolicy policy,
                                            @Value("${history.relational.rowCap:5000}") int rowCap) {
        log.info("History backend: relational (sqlite), rowCap={}", rowCap);
        return new SqliteMetricsBackend(jdbc, policy, rowCap);
    }

    @Configuration
    @ConditionalOnProperty(name = "history.backend", havingValue = "columnar")
    static class Columnar {

        @Value("${influx.url}")                     private String url;
        @Value("${influx.token}")                   private String token;
        @Value("${influx.org}")                     private String org;
        @Value("${influx.bucket}")                  private String bucket;
        @Value("${influx.measurement:device_reading}") private String measurement;

        @Bean(destroyMethod = "close")
        public InfluxDBClient influxDBClient() {
            return InfluxDBClientFactory.create(url, token.toCharArray(), org, bucket);
        }

        @Bean
        public ColumnarReadClient columnarReadClient(InfluxDBClient client) {
            return new InfluxColumnarReadClient(client.getQueryApi(), org);
        }

        @Bean
        public MetricsBackend columnarBackend(ColumnarReadClient client, FieldAggregationPolicy policy) {
            log.info("History backend: columnar (influx) url={} org={} bucket={} measurement={}",
                    url, org, bucket, measurement);
            return new InfluxMetricsBackend(client, policy, bucket, measurement);
        }
    }
}
