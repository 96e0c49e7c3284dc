package com.gamelog.core.parser;

import com.gamelog.core.model.Action;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KillDecoderTest {

    private final KillDecoder decoder = new KillDecoder();

    @Test
    void decodesPlayerKill() {
        assertThat(decoder.decode("2 3 7: Isgalamido killed Mocinha by MOD_ROCKET_SPLASH"))
                .contains(new Action.Kill(2, 3, 7, "Isgalamido", "Mocinha", "MOD_ROCKET_SPLASH"));
    }

    @Test
    void decodesWorldKill() {
        Action.Kill kill = decoder.decode("1022 2 22: <world> killed Isgalamido by MOD_TRIGGER_HURT").orElseThrow();

        assertThat(kill.playerName()).isEqualTo(Action.WORLD);
        assertThat(kill.isWorldKill()).isTrue();
        assertThat(kill.killId()).isEqualTo(1022);
        assertThat(kill.victimName()).isEqualTo("Isgalamido");
        assertThat(kill.method()).isEqualTo("MOD_TRIGGER_HURT");
    }

    @Test
    void namesMayContainSpaces() {
        assertThat(decoder.decode("3 5 6: Dono da Bola killed Assasinu Credi by MOD_RAILGUN"))
                .contains(new Action.Kill(3, 5, 6, "Dono da Bola", "Assasinu Credi", "MOD_RAILGUN"));
    }

    @Test
    void splitsOnFirstKilledAndFirstByAfterIt() {
        assertThat(decoder.decode("1 2 3: Jack killed Jill killed Joe by way by MOD_GAUNTLET"))
                .contains(new Action.Kill(1, 2, 3, "Jack", "Jill killed Joe", "way by MOD_GAUNTLET"));
    }

    @Test
    void onlyFirstColonSeparatesIds() {
        assertThat(decoder.decode("4 1 2: A:B killed C by MOD_SHOTGUN"))
                .contains(new Action.Kill(4, 1, 2, "A:B", "C", "MOD_SHOTGUN"));
    }

    @Test
    void requiresExactlyThreeIds() {
        assertThat(decoder.decode("2 3: A killed B by MOD_SHOTGUN")).isEmpty();
        assertThat(decoder.decode("2 3 7 8: A killed B by MOD_SHOTGUN")).isEmpty();
        assertThat(decoder.decode(": A killed B by MOD_SHOTGUN")).isEmpty();
    }

    @Test
    void requiresNumericIds() {
        assertThat(decoder.decode("2 x 7: A killed B by MOD_SHOTGUN")).isEmpty();
        assertThat(decoder.decode("2 3 -7: A killed B by MOD_SHOTGUN")).isEmpty();
    }

    @Test
    void requiresDescriptionShape() {
        assertThat(decoder.decode("2 3 7 A killed B by MOD_SHOTGUN")).isEmpty();
        assertThat(decoder.decode("2 3 7: A fragged B by MOD_SHOTGUN")).isEmpty();
        assertThat(decoder.decode("2 3 7: A killed B")).isEmpty();
        assertThat(decoder.decode("2 3 7: killed B by MOD_SHOTGUN")).isEmpty();
    }

    @Test
    void fieldsSurviveReformatting() {
        Action.Kill kill = new Action.Kill(17, 4, 9, "Zeh", "Oootsimo", "MOD_SHOTGUN");
        String line = kill.killId() + " " + kill.playerId() + " " + kill.victimId() + ": "
                + kill.playerName() + " killed " + kill.victimName() + " by " + kill.method();

        assertThat(decoder.decode(line)).contains(kill);
    }

    @Test
    void namesMayContainUnicodeLineSeparators() {
        assertThat(decoder.decode("1 2 3: A\u0085x killed B\u2028y by MOD_SHOTGUN"))
                .contains(new Action.Kill(1, 2, 3, "A\u0085x", "B\u2028y", "MOD_SHOTGUN"));
    }
}
