package com.offerflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Offer 规划服务启动类。
 * <p>
 * 位于顶层包，扫描 trigger、domain 与 infrastructure 各模块中的组件。
 * </p>
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
