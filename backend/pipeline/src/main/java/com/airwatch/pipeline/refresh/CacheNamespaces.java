package com.airwatch.pipeline.refresh;

import com.airwatch.core.cache.CacheNamespace;
import com.airwatch.core.model.ForecastView;
import com.airwatch.core.model.LiveView;

public final class CacheNamespaces {
    public static final CacheNamespace<LiveView> LIVE = new CacheNamespace<>("live", LiveView.class);
    public static final CacheNamespace<ForecastView> FORECAST = new CacheNamespace<>("forecast", ForecastView.class);

    private CacheNamespaces() {
    }
}
