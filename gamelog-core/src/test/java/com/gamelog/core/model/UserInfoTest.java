package com.gamelog.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UserInfoTest {

    @Test
    void extractsNameAfterMarker() {
        assertThat(UserInfo.playerName("n\\Isgalamido\\t\\0\\model\\xian/default")).contains("Isgalamido");
        assertThat(UserInfo.playerName("n\\Isgalamido\\t\\0\\model\\xian/default\\hmodel\\xian/default"))
                .contains("Isgalamido");
    }

    @Test
    void nameRunsToEndWithoutTrailingBackslash() {
        assertThat(UserInfo.playerName("n\\Dono da Bola")).contains("Dono da Bola");
    }

    @Test
    void missingMarkerYieldsNothing() {
        assertThat(UserInfo.playerName("t\\0\\model\\sarge")).isEmpty();
        assertThat(UserInfo.playerName("")).isEmpty();
        assertThat(UserInfo.playerName(null)).isEmpty();
    }

    @Test
    void markerAtEndYieldsNothing() {
        assertThat(UserInfo.playerName("t\\0\\n\\")).isEmpty();
    }
}
