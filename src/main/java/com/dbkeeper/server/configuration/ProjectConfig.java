package com.dbkeeper.server.configuration;

import com.baomidou.mybatisplus.annotation.DbType;
import com.baomidou.mybatisplus.extension.plugins.MybatisPlusInterceptor;
import com.baomidou.mybatisplus.extension.plugins.inner.PaginationInnerInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ProjectConfig {

    // every cron expression and setting time is evaluated in this zone
    @Bean
    public ZoneId schedulerZoneId(@Value("${dbkeeper.server.scheduler.timezone:Europe/Istanbul}") String timezone) {
        return ZoneId.of(timezone);
    }

    @Bean
    public Clock clock(ZoneId schedulerZoneId) {
        return Clock.system(schedulerZoneId);
    }

    @Bean
    public MybatisPlusInterceptor mybatisPlusInterceptor() {
        MybatisPlusInterceptor mybatisPlusInterceptor = new MybatisPlusInterceptor();
        mybatisPlusInterceptor.addInnerInterceptor(new PaginationInnerInterceptor(DbType.MARIADB));
        return mybatisPlusInterceptor;
    }
}
