package com.querier.query.filter;

/**
 * HAVING clause under construction; compiled exactly like a WHERE clause
 */
public class Having extends Where {

    public Having() {
        super();
    }

    public Having(TimeWindow timeWindow) {
        super(timeWindow);
    }

    @Override
    protected String keyword() {
        return "HAVING";
    }
}
