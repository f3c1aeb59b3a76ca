package max.pente.engine.game.board;

/**
 * One entry of the undo log, pushed by every applied move and popped by every undo.
 */
public record MovePlayed(int move, byte color, int previousLastMove, CapturePlayed capture) {
}
