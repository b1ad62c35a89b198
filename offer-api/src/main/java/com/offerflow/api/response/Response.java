package com.offerflow.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * offer-flow 接口响应信封，规划、生命周期与决策记录接口共用。
 * <p>
 * 成功时 code 为 0000、data 为业务视图；失败时 code 取 1xxx 业务码（0001/0002 为通用错误），
 * data 为空，HTTP 状态码由全局异常处理按业务码映射。
 * </p>
 *
 * @param <T> 业务视图类型
 * @author offerflow
 * @since 2026-10-19
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    /**
     * 字段集合 {code, info, data} 变化时才更换此值
     */
    private static final long serialVersionUID = -3185106624459372809L;

    /** 业务码 */
    private String code;

    /** 面向调用方的说明，失败时为具体原因，如 "依赖不存在: 9" */
    private String info;

    private T data;

}
