package com.gamelog.core.parser;

import com.gamelog.core.model.Action;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.BiFunction;
import java.util.function.LongFunction;

/**
 * Turns the text after the timestamp into an {@link Action}.
 * <p>
 * Keywords are matched by prefix, in a fixed order, first match wins.
 * Content that has a colon but no known keyword becomes {@link Action.Other};
 * content without any colon, or a known keyword with a malformed payload,
 * decodes to nothing.
 */
public class ActionDecoder {

    static final String INIT_GAME = "InitGame:";
    static final String SHUTDOWN_GAME = "ShutdownGame:";
    static final String CLIENT_CONNECT = "ClientConnect:";
    static final String CLIENT_USERINFO_CHANGED = "ClientUserinfoChanged:";
    static final String CLIENT_BEGIN = "ClientBegin:";
    static final String CLIENT_DISCONNECT = "ClientDisconnect:";
    static final String ITEM = "Item:";
    static final String KILL = "Kill:";

    private final KillDecoder killDecoder;

    public ActionDecoder() {
        this(new KillDecoder());
    }

    public ActionDecoder(KillDecoder killDecoder) {
        this.killDecoder = killDecoder;
    }

    public Optional<Action> decode(String content) {
        if (content == null) {
            return Optional.empty();
        }
        if (content.startsWith(INIT_GAME)) {
            return Optional.of(new Action.InitGame(afterPrefix(content, INIT_GAME)));
        }
        if (content.equals(SHUTDOWN_GAME)) {
            return Optional.of(new Action.ShutdownGame());
        }
        if (content.startsWith(CLIENT_CONNECT)) {
            return playerId(content, CLIENT_CONNECT, Action.ClientConnect::new);
        }
        if (content.startsWith(CLIENT_USERINFO_CHANGED)) {
            return idAndText(content, CLIENT_USERINFO_CHANGED, Action.ClientUserinfoChanged::new);
        }
        if (content.startsWith(CLIENT_BEGIN)) {
            return playerId(content, CLIENT_BEGIN, Action.ClientBegin::new);
        }
        if (content.startsWith(CLIENT_DISCONNECT)) {
            return playerId(content, CLIENT_DISCONNECT, Action.ClientDisconnect::new);
        }
        if (content.startsWith(ITEM)) {
            return idAndText(content, ITEM, Action.Item::new);
        }
        if (content.startsWith(KILL)) {
            return killDecoder.decode(afterPrefix(content, KILL)).map(Action.class::cast);
        }

        int colon = content.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        return Optional.of(new Action.Other(content.substring(0, colon), content.substring(colon + 1).strip()));
    }

    private static Optional<Action> playerId(String content, String prefix, LongFunction<Action> ctor) {
        OptionalLong id = parseId(afterPrefix(content, prefix));
        return id.isPresent() ? Optional.of(ctor.apply(id.getAsLong())) : Optional.empty();
    }

    // "<id> <free text>", split at the first space; the text is kept as is
    private static Optional<Action> idAndText(String content, String prefix,
                                              BiFunction<Long, String, Action> ctor) {
        String payload = afterPrefix(content, prefix);
        int space = payload.indexOf(' ');
        if (space < 0) {
            return Optional.empty();
        }
        OptionalLong id = parseId(payload.substring(0, space));
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ctor.apply(id.getAsLong(), payload.substring(space + 1)));
    }

    private static String afterPrefix(String content, String prefix) {
        return content.substring(prefix.length()).strip();
    }

    /**
     * Parses an unsigned 32-bit decimal. Empty on signs other than '+',
     * non-digits, or values above 4294967295.
     */
    static OptionalLong parseId(String text) {
        if (text == null || text.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Integer.toUnsignedLong(Integer.parseUnsignedInt(text)));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
