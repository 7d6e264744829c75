package net.cronhook.core.model;

public enum HttpMethod {
    GET, POST, PUT, DELETE;

    /** GET 외에는 요청 본문을 싣는다 */
    public boolean carriesBody() {
        return this != GET;
    }
}
