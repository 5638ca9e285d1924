package com.airwatch.service.read;

import com.airwatch.pipeline.refresh.RefreshOutcome;

@FunctionalInterface
public interface OnDemandRefresh {
    RefreshOutcome refresh(String target);
}
