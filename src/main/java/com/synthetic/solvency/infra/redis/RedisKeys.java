package com.synthetic.solvency.infra.redis;

public final class RedisKeys {

    public static final String PRICE_SUBMISSIONS = "price:submissions:";
    public static final String PRICE_ASSETS_SET = "assets:price";
    public static final String LIQUIDATION_RECORDS = "liq:records";
    public static final String POSITION_LATEST = "position:latest:";
    public static final String POSITION_ACCOUNTS_SET = "accounts:position";

    private RedisKeys() {
    }
}
