package com.gamelog.core.parser;

import com.gamelog.core.model.Action;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the payload of a {@code Kill:} line, e.g.
 * {@code 1022 2 22: <world> killed Isgalamido by MOD_TRIGGER_HURT}.
 * Either every field decodes or the whole kill is dropped.
 */
public class KillDecoder {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // reluctant groups: the first " killed " and the first " by " after it are the separators
    private static final Pattern DESCRIPTION =
            Pattern.compile("^(.+?)\\s+killed\\s+(.+?)\\s+by\\s+(.+)$", Pattern.DOTALL);

    public Optional<Action.Kill> decode(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        int colon = payload.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        String idsPart = payload.substring(0, colon).strip();
        String description = payload.substring(colon + 1).strip();

        if (idsPart.isEmpty()) {
            return Optional.empty();
        }
        String[] ids = WHITESPACE.split(idsPart);
        if (ids.length != 3) {
            return Optional.empty();
        }
        OptionalLong killId = ActionDecoder.parseId(ids[0]);
        OptionalLong playerId = ActionDecoder.parseId(ids[1]);
        OptionalLong victimId = ActionDecoder.parseId(ids[2]);
        if (killId.isEmpty() || playerId.isEmpty() || victimId.isEmpty()) {
            return Optional.empty();
        }

        Matcher m = DESCRIPTION.matcher(description);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Action.Kill(
                killId.getAsLong(),
                playerId.getAsLong(),
                victimId.getAsLong(),
                m.group(1),
                m.group(2),
                m.group(3)));
    }
}
