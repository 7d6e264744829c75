package net.cronhook.core.spi;

import java.util.concurrent.Callable;

/** 브로커 저장소 트랜잭션 경계 */
public interface TxRunner {
    /** 진행 중 트랜잭션이 있으면 참여, 없으면 새로 시작 */
    <T> T required(Callable<T> body) throws Exception;

    /** 바깥 트랜잭션과 무관하게 새 트랜잭션에서 실행 (CAS 한 건 = 커밋 한 번) */
    <T> T requiresNew(Callable<T> body) throws Exception;
}
