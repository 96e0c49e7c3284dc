package com.gamelog.core.model;

import java.util.Objects;

/**
 * What happened on a log line, after the timestamp.
 * The set of variants is closed; anything the decoder does not know lands in {@link Other}.
 */
public sealed interface Action
        permits Action.InitGame, Action.ShutdownGame, Action.ClientConnect,
        Action.ClientUserinfoChanged, Action.ClientBegin, Action.Item,
        Action.Kill, Action.ClientDisconnect, Action.Other {

    /** Name of the environment when it is the killer (falls, lava, triggers). */
    String WORLD = "<world>";

    ActionType type();

    /** Session start; {@code details} is the raw server configuration string. */
    record InitGame(String details) implements Action {
        public InitGame {
            Objects.requireNonNull(details, "details");
        }

        @Override
        public ActionType type() {
            return ActionType.INIT_GAME;
        }
    }

    record ShutdownGame() implements Action {
        @Override
        public ActionType type() {
            return ActionType.SHUTDOWN_GAME;
        }
    }

    record ClientConnect(long playerId) implements Action {
        @Override
        public ActionType type() {
            return ActionType.CLIENT_CONNECT;
        }
    }

    /** {@code info} is the backslash-delimited userinfo blob, kept verbatim. */
    record ClientUserinfoChanged(long playerId, String info) implements Action {
        public ClientUserinfoChanged {
            Objects.requireNonNull(info, "info");
        }

        @Override
        public ActionType type() {
            return ActionType.CLIENT_USERINFO_CHANGED;
        }
    }

    record ClientBegin(long playerId) implements Action {
        @Override
        public ActionType type() {
            return ActionType.CLIENT_BEGIN;
        }
    }

    record Item(long itemId, String description) implements Action {
        public Item {
            Objects.requireNonNull(description, "description");
        }

        @Override
        public ActionType type() {
            return ActionType.ITEM;
        }
    }

    record Kill(long killId, long playerId, long victimId,
                String playerName, String victimName, String method) implements Action {
        public Kill {
            Objects.requireNonNull(playerName, "playerName");
            Objects.requireNonNull(victimName, "victimName");
            Objects.requireNonNull(method, "method");
        }

        /** True when the kill was environmental rather than by a player. */
        public boolean isWorldKill() {
            return WORLD.equals(playerName);
        }

        @Override
        public ActionType type() {
            return ActionType.KILL;
        }
    }

    record ClientDisconnect(long playerId) implements Action {
        @Override
        public ActionType type() {
            return ActionType.CLIENT_DISCONNECT;
        }
    }

    /** Any keyword the decoder does not recognise, split at its first colon. */
    record Other(String actionName, String details) implements Action {
        public Other {
            Objects.requireNonNull(actionName, "actionName");
            Objects.requireNonNull(details, "details");
        }

        @Override
        public ActionType type() {
            return ActionType.OTHER;
        }
    }
}
