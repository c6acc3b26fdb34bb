/*
 * どこで: Perks アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: ティア設定と共通 Clock をまとめて有効化するため
 */
package com.example.perks;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class PerksApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerksApplication.class, args);
    }
}
