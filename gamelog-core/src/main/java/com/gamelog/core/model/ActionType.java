package com.gamelog.core.model;

/**
 * One constant per {@link Action} variant, for exhaustive switches.
 */
public enum ActionType {
    INIT_GAME,
    SHUTDOWN_GAME,
    CLIENT_CONNECT,
    CLIENT_USERINFO_CHANGED,
    CLIENT_BEGIN,
    ITEM,
    KILL,
    CLIENT_DISCONNECT,
    OTHER
}
