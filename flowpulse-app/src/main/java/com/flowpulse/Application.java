package com.flowpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FlowPulse 启动类。
 * <p>
 * 位于顶层包，扫描 trigger / infrastructure / domain 各模块组件。
 * </p>
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
