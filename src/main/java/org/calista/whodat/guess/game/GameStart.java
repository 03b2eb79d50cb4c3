package org.calista.whodat.guess.game;

import org.calista.whodat.guess.state.GameState;

import java.util.Objects;

/** A fresh game and its first prompt. */
public final class GameStart {
    public final GameState state;
    public final Turn turn;

    GameStart(GameState state, Turn turn) {
        this.state = Objects.requireNonNull(state, "state");
        this.turn = Objects.requireNonNull(turn, "turn");
    }
}
