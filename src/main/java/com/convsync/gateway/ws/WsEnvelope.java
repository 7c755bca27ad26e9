package com.convsync.gateway.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * WS 文本帧的 JSON 信封。
 *
 * <p>下行：SYNC_START / EVENT / CATCH_UP_DONE / SIGNAL / RESYNC / PING / PONG / ERROR</p>
 * <p>上行：PING / TYPING；其他类型与无法解析的帧直接忽略。</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WsEnvelope {

    public static final String SYNC_START = "SYNC_START";
    public static final String EVENT = "EVENT";
    public static final String CATCH_UP_DONE = "CATCH_UP_DONE";
    public static final String SIGNAL = "SIGNAL";
    public static final String RESYNC = "RESYNC";
    public static final String PING = "PING";
    public static final String PONG = "PONG";
    public static final String ERROR = "ERROR";
    public static final String TYPING = "TYPING";

    /** 消息类型（路由字段）。 */
    public String type;

    public String conversationId;

    /**
     * 设备标识。SYNC_START 中下发；客户端应持久化并在重连时通过 query 参数 clientId 带回，否则无法续传。
     */
    public String clientId;

    /**
     * 日志条目 id（{@code <ms>-<seq>}）。EVENT：该事件的 id，客户端可据此去重；
     * SYNC_START：服务端记录的游标；CATCH_UP_DONE：补齐到的位置；RESYNC：重新同步的起点。
     */
    public String streamEntryId;

    /** 事件正文：生产方定义的不透明字符串，网关不解析。 */
    public String payload;

    /** SIGNAL：信号发起方 userId（以握手绑定的身份为准，不信任客户端填写）。 */
    public Long from;

    /** 错误原因（ERROR 时返回）。 */
    public String reason;

    /** 时间戳（毫秒）。EVENT 为生产时间，其余为发送时间。 */
    public Long ts;

    public static WsEnvelope of(String type) {
        WsEnvelope env = new WsEnvelope();
        env.type = type;
        return env;
    }
}
