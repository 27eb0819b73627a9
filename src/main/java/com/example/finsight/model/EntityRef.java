package com.example.finsight.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 조회 대상 기업. id 는 SEC CIK(10자리) 또는 CIK 를 모르는 경우 티커.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class EntityRef {
    private final String id;
    private final String ticker;
    private final String name;
    private final String cik;

    public static EntityRef ofTicker(String ticker) {
        return new EntityRef(ticker, ticker, null, null);
    }

    public static EntityRef ofCik(String ticker, String cik, String name) {
        return new EntityRef(cik, ticker, name, cik);
    }

    public boolean hasCik() {
        return cik != null && !cik.isBlank();
    }
}
