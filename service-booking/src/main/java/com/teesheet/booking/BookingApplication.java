package com.teesheet.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {
        "com.teesheet.booking",
        "com.teesheet.common.exception",   // GlobalExceptionHandler 스캔
        "com.teesheet.common.idempotency"  // @Idempotent AOP 스캔
})
@EnableScheduling  // 잔여 인원 정합성 복구 스케줄러 활성화
public class BookingApplication {
    public static void main(String[] args) {
        SpringApplication.run(BookingApplication.class, args);
    }
}
