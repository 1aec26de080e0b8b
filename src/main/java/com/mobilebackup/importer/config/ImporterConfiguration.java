package com.mobilebackup.importer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ImporterConfiguration {

    /** 冷却计时、入库时间戳都走这个时钟，测试里可以替换 */
    @Bean
    public Clock importerClock() {
        return Clock.systemUTC();
    }
}
