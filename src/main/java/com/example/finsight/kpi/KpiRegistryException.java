package com.example.finsight.kpi;

/** 지표 표가 DAG 가 아니거나 모르는 입력을 참조함. 기동을 중단시킨다 */
public class KpiRegistryException extends RuntimeException {
    public KpiRegistryException(String message) {
        super(message);
    }
}
