package com.example.finsight.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * finance.* 설정. 기본값은 application.yml 이 비어 있어도 동작하도록 여기서 준다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "finance")
public class FinanceProperties {

    private Router router = new Router();
    private Store store = new Store();
    private Period period = new Period();
    private Health health = new Health();
    private Validation validation = new Validation();

    @Getter
    @Setter
    public static class Router {
        /** 원천 1회 호출 제한 시간 */
        private Duration adapterTimeout = Duration.ofSeconds(5);
        /** UNAVAILABLE/RATE_LIMITED 재시도 횟수 */
        private int maxRetries = 2;
        private Duration backoff = Duration.ofMillis(200);
        /** deadlineMs 파라미터가 없을 때 요청 전체 제한 시간 */
        private Duration requestDeadline = Duration.ofSeconds(15);
        /** 비활성화할 원천 id 목록 */
        private List<String> disabledSources = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Store {
        private Duration factTtl = Duration.ofHours(24);
        private Duration liveTtl = Duration.ofMinutes(5);
        private long maximumSize = 50_000;
        private boolean l2Enabled = true;
    }

    @Getter
    @Setter
    public static class Period {
        /** 같은 기말일 후보의 max/min 이 이 비율 이상일 때만 작은 값을 고른다 */
        private double magnitudeRatio = 2.0;
    }

    @Getter
    @Setter
    public static class Health {
        private int failureThreshold = 3;
        private Duration cooldown = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Validation {
        private List<Rule> rules = new ArrayList<>();
    }

    /** 티커("*" 는 전체)·항목·빈도별 허용 범위 */
    @Getter
    @Setter
    public static class Rule {
        private String ticker = "*";
        private String concept;
        private String frequency;
        private BigDecimal min;
        private BigDecimal max;
    }
}
