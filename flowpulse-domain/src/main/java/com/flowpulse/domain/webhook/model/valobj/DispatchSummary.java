package com.flowpulse.domain.webhook.model.valobj;

/**
 * 一次 dispatch 的汇总：全部匹配端点成功才算成功，无匹配端点视为失败。
 */
public record DispatchSummary(int matchedEndpoints, int succeededEndpoints) {

    public boolean success() {
        return matchedEndpoints > 0 && succeededEndpoints == matchedEndpoints;
    }
}
