package com.feed.shield.gateway.core.store;

/**
 * Primitive operations every store backend understands, with the canonical
 * reply type the adapter hands back to callers.
 */
public enum StoreOp {
    GET(Reply.STRING),
    SETEX(Reply.BOOLEAN),
    DEL(Reply.LONG),
    INCR(Reply.LONG),
    INCRBY(Reply.LONG),
    EXPIRE(Reply.BOOLEAN),
    PEXPIRE(Reply.BOOLEAN),
    ZADD(Reply.BOOLEAN),
    ZCARD(Reply.LONG),
    ZREMRANGEBYSCORE(Reply.LONG),
    /** ZRANGE key 0 0 WITHSCORES, reduced to the score. */
    ZMINSCORE(Reply.SCORE),
    PFADD(Reply.BOOLEAN),
    PFCOUNT(Reply.LONG);

    public enum Reply {STRING, LONG, BOOLEAN, SCORE}

    private final Reply reply;

    StoreOp(Reply reply) {
        this.reply = reply;
    }

    public Reply reply() {
        return reply;
    }
}
