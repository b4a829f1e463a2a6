package com.imperium.lexi;

import com.imperium.lexi.config.DotenvLoader;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@MapperScan("com.imperium.lexi.mapper")
public class LexiCoreApplication {

    public static void main(String[] args) {
        DotenvLoader.load(); // 加载 .env 到系统属性，供 application.yaml 中的 ${VAR} 使用
        SpringApplication.run(LexiCoreApplication.class, args);
    }
}
