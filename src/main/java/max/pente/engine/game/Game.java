package max.pente.engine.game;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import max.pente.engine.game.board.Board;
import max.pente.engine.game.board.CapturePlayed;
import max.pente.engine.game.board.MovePlayed;
import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.game.rules.CaptureRules;
import max.pente.engine.game.rules.WinRules;
import max.pente.engine.movegen.CandidateGenerator;
import max.pente.engine.movegen.Move;
import max.pente.engine.utils.ColorUtils;
import max.pente.engine.utils.notations.MoveIOUtils;

import java.util.Arrays;

/**
 * State of a Pente game: grid, move counter, captured pairs per color, undo log and win state.
 * <p>
 * Search plays and rewinds millions of moves on the same instance, so {@link #makeMove} and
 * {@link #undoMove} must be called in strict LIFO order. Nothing checks that order: undoing out
 * of order corrupts the capture tallies. An instance must not be shared between threads,
 * use {@link #copy()} to analyse the position elsewhere.
 */
public class Game {
    private final Board board;
    private final boolean tournamentRule;

    private int moveCount = 0;
    private final int[] captures = new int[2];
    private final ObjectArrayList<MovePlayed> history;
    private int lastMove = Move.NONE;

    private byte winner = ColorUtils.EMPTY;
    private final IntArrayList winningSequence = new IntArrayList(WinRules.WINNING_LENGTH);

    public Game() {
        this(false);
    }

    public Game(boolean tournamentRule) {
        this.board = new Board();
        this.tournamentRule = tournamentRule;
        this.history = new ObjectArrayList<>(BoardUtils.CELLS);
    }

    private Game(Game other) {
        this.board = new Board(other.board);
        this.tournamentRule = other.tournamentRule;
        this.moveCount = other.moveCount;
        this.captures[0] = other.captures[0];
        this.captures[1] = other.captures[1];
        this.history = new ObjectArrayList<>(other.history);
        this.lastMove = other.lastMove;
        this.winner = other.winner;
        this.winningSequence.addAll(other.winningSequence);
    }

    public Game copy() {
        return new Game(this);
    }

    public boolean isValidMove(int row, int col, int color) {
        if (!BoardUtils.isOnBoard(row, col) || board.get(row, col) != ColorUtils.EMPTY) {
            return false;
        }
        if (tournamentRule) {
            if (moveCount == 0) {
                return row == BoardUtils.CENTER && col == BoardUtils.CENTER;
            }
            if (moveCount == 2) {
                return BoardUtils.distanceFromCenter(row, col) >= CandidateGenerator.TOURNAMENT_MIN_DISTANCE;
            }
        }
        return true;
    }

    /**
     * Plays {@code color} at {@code (row, col)}, removes the pairs it captures and updates the winner.
     *
     * @return false, with no side effect, when the move is illegal
     */
    public boolean makeMove(int row, int col, int color) {
        if (!isValidMove(row, col, color)) {
            return false;
        }
        final byte stone = (byte) color;
        final int move = Move.asBytes(row, col);
        board.place(move, stone);
        moveCount++;
        final int previousLastMove = lastMove;
        lastMove = move;

        CapturePlayed capture = CaptureRules.captureAround(board, row, col, stone);
        if (!capture.isNone()) {
            captures[ColorUtils.index(stone)] += capture.pairCount();
        }
        history.push(new MovePlayed(move, stone, previousLastMove, capture));

        updateWinner(stone);
        return true;
    }

    public boolean makeMove(int move, int color) {
        return makeMove(Move.getRow(move), Move.getCol(move), color);
    }

    /**
     * Rewinds the last move, which must be the one played at {@code (row, col)}.
     * The win state is always cleared, it gets recomputed by the next {@link #makeMove}.
     */
    public void undoMove(int row, int col) {
        board.remove(Move.asBytes(row, col));
        moveCount--;
        winner = ColorUtils.EMPTY;
        winningSequence.clear();

        MovePlayed movePlayed = history.pop();
        lastMove = movePlayed.previousLastMove();
        CapturePlayed capture = movePlayed.capture();
        if (!capture.isNone()) {
            CaptureRules.restore(board, capture);
            captures[ColorUtils.index(capture.capturingColor())] -= capture.pairCount();
        }
    }

    public void undoMove(int move) {
        undoMove(Move.getRow(move), Move.getCol(move));
    }

    public void undoLastMove() {
        undoMove(history.top().move());
    }

    private void updateWinner(byte color) {
        if (WinRules.isWinning(board, color, captures[ColorUtils.index(color)], winningSequence)) {
            winner = color;
        }
    }

    public IntArrayList getCandidateMoves(int radius) {
        return CandidateGenerator.generateMoves(this, radius);
    }

    public int getCandidateMoves(int radius, IntArrayList buffer) {
        return CandidateGenerator.generateMoves(this, radius, buffer);
    }

    // True when the next move is the first player's second one under the tournament rule
    public boolean isTournamentRestricted() {
        return tournamentRule && moveCount == 2;
    }

    /**
     * Position setup, bypassing captures, win detection and the undo log.
     * Counts as a move so that the side to move keeps following the stone parity.
     */
    public void setupStone(int row, int col, int color) {
        if (!BoardUtils.isOnBoard(row, col) || !ColorUtils.isStone(color)) {
            throw new IllegalArgumentException("Invalid setup stone " + color + " at " + row + "," + col);
        }
        final int cell = Move.asBytes(row, col);
        board.remove(cell);
        board.place(cell, (byte) color);
        moveCount++;
        lastMove = cell;
    }

    public void setupCaptures(int color, int pairs) {
        captures[ColorUtils.index(color)] = pairs;
    }

    public void setupMoveCount(int moveCount) {
        this.moveCount = moveCount;
    }

    /**
     * Plays space separated moves (e.g. {@code "K10 L10 K11"}), colors alternating from the
     * side to move.
     */
    public void playMoves(String moves) {
        for (String notation : moves.trim().split("\\s+")) {
            if (notation.isEmpty()) {
                continue;
            }
            Move move = MoveIOUtils.readMove(notation);
            if (!makeMove(move.row(), move.col(), currentPlayer())) {
                throw new IllegalArgumentException("Illegal move " + notation + " in " + moves);
            }
        }
    }

    public Board board() {
        return board;
    }

    public byte getCell(int row, int col) {
        return board.get(row, col);
    }

    public int moveCount() {
        return moveCount;
    }

    public byte currentPlayer() {
        return (moveCount & 1) == 0 ? ColorUtils.WHITE : ColorUtils.BLACK;
    }

    public int captures(int color) {
        return captures[ColorUtils.index(color)];
    }

    public byte winner() {
        return winner;
    }

    public boolean isOver() {
        return winner != ColorUtils.EMPTY || board.isFull();
    }

    public IntList winningSequence() {
        return IntLists.unmodifiable(winningSequence);
    }

    public int lastMove() {
        return lastMove;
    }

    public boolean isFull() {
        return board.isFull();
    }

    public int captureHistoryDepth() {
        return history.size();
    }

    public boolean tournamentRule() {
        return tournamentRule;
    }

    public long zobristKey() {
        return board.zobristKey() ^ ZobristHashKeys.capturesKey(captures[0], captures[1]);
    }

    public int[] gridSnapshot() {
        int[] snapshot = new int[BoardUtils.CELLS];
        for (int cell = 0; cell < BoardUtils.CELLS; cell++) {
            snapshot[cell] = board.get(cell);
        }
        return snapshot;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Game game = (Game) o;
        return moveCount == game.moveCount
                && Arrays.equals(captures, game.captures)
                && board.equals(game.board);
    }

    @Override
    public int hashCode() {
        return (int) zobristKey();
    }

    @Override
    public String toString() {
        return boardAscii(this);
    }

    /** ASCII diagram, row 19 on top. {@code O} is white, {@code X} is black. */
    public static String boardAscii(Game game) {
        StringBuilder sb = new StringBuilder(BoardUtils.SIZE * (BoardUtils.SIZE * 2 + 5));
        for (int row = BoardUtils.SIZE - 1; row >= 0; row--) {
            sb.append(String.format("%2d ", row + 1));
            for (int col = 0; col < BoardUtils.SIZE; col++) {
                sb.append(stoneChar(game.getCell(row, col))).append(' ');
            }
            sb.append('\n');
        }
        sb.append("   ");
        for (int col = 0; col < BoardUtils.SIZE; col++) {
            sb.append(MoveIOUtils.writeNotation(0, col).charAt(0)).append(' ');
        }
        sb.append("\nCaptures: WHITE ").append(game.captures(ColorUtils.WHITE))
                .append(" BLACK ").append(game.captures(ColorUtils.BLACK));
        return sb.toString();
    }

    private static char stoneChar(byte color) {
        return switch (color) {
            case ColorUtils.WHITE -> 'O';
            case ColorUtils.BLACK -> 'X';
            default -> '.';
        };
    }
}
