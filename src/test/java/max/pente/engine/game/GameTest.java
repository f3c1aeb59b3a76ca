package max.pente.engine.game;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.pente.engine.game.board.utils.BoardGenerator;
import max.pente.engine.game.board.utils.BoardUtils;
import max.pente.engine.movegen.Move;
import max.pente.engine.utils.ColorUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class GameTest {

    @Test
    public void illegalMoveIsRejectedWithoutSideEffect() {
        // Given
        Game game = BoardGenerator.fromMoves("K10 L10");
        long key = game.zobristKey();

        // When / Then
        assertFalse(game.makeMove(9, 9, ColorUtils.WHITE), "occupied cell");
        assertFalse(game.makeMove(-1, 3, ColorUtils.WHITE), "row out of the board");
        assertFalse(game.makeMove(4, 19, ColorUtils.WHITE), "col out of the board");

        assertEquals(2, game.moveCount());
        assertEquals(2, game.captureHistoryDepth());
        assertEquals(key, game.zobristKey());
        assertEquals(Move.asBytes(9, 10), game.lastMove());
    }

    @Test
    public void whiteMovesOnEvenMoveCount() {
        Game game = BoardGenerator.newGame();
        assertEquals(ColorUtils.WHITE, game.currentPlayer());
        game.makeMove(9, 9, ColorUtils.WHITE);
        assertEquals(ColorUtils.BLACK, game.currentPlayer());
    }

    @ParameterizedTest
    @CsvSource({"0,1", "0,-1", "1,0", "-1,0", "1,1", "-1,-1", "1,-1", "-1,1"})
    public void bracketingAPairCapturesIt(int dr, int dc) {
        // Given: O X X _ along the direction, O plays the empty end
        Game game = new Game();
        game.setupStone(9 + dr, 9 + dc, ColorUtils.BLACK);
        game.setupStone(9 + 2 * dr, 9 + 2 * dc, ColorUtils.BLACK);
        game.setupStone(9 + 3 * dr, 9 + 3 * dc, ColorUtils.WHITE);
        game.setupMoveCount(4);
        int[] before = game.gridSnapshot();
        long keyBefore = game.zobristKey();

        // When
        assertTrue(game.makeMove(9, 9, ColorUtils.WHITE));

        // Then
        assertEquals(1, game.captures(ColorUtils.WHITE));
        assertEquals(0, game.captures(ColorUtils.BLACK));
        assertEquals(ColorUtils.EMPTY, game.getCell(9 + dr, 9 + dc));
        assertEquals(ColorUtils.EMPTY, game.getCell(9 + 2 * dr, 9 + 2 * dc));
        assertEquals(ColorUtils.WHITE, game.getCell(9 + 3 * dr, 9 + 3 * dc));
        assertEquals(2, game.board().countStones(ColorUtils.WHITE));
        assertEquals(0, game.board().countStones(ColorUtils.BLACK));

        // And undo puts the pair back
        game.undoMove(9, 9);
        assertArrayEquals(before, game.gridSnapshot());
        assertEquals(0, game.captures(ColorUtils.WHITE));
        assertEquals(keyBefore, game.zobristKey());
    }

    @Test
    public void oneMoveCanCaptureInSeveralDirections() {
        // Given: pairs to the east and to the south of K10, both closed by white
        Game game = BoardGenerator.fromStones("N10 K7", "L10 M10 K9 K8", ColorUtils.WHITE);

        // When
        assertTrue(game.makeMove(9, 9, ColorUtils.WHITE));

        // Then
        assertEquals(2, game.captures(ColorUtils.WHITE));
        assertEquals(0, game.board().countStones(ColorUtils.BLACK));
        assertEquals(1, game.captureHistoryDepth());

        game.undoLastMove();
        assertEquals(0, game.captures(ColorUtils.WHITE));
        assertEquals(4, game.board().countStones(ColorUtils.BLACK));
        assertEquals(0, game.captureHistoryDepth());
    }

    @Test
    public void noCaptureWithoutTheClosingStone() {
        // Three in a row is not a pair, an open end is not a bracket
        Game game = BoardGenerator.fromStones("N10", "L10 M10 K11 K12", ColorUtils.WHITE);
        game.setupStone(8, 10, ColorUtils.BLACK);
        game.setupStone(7, 11, ColorUtils.BLACK);
        game.setupStone(6, 12, ColorUtils.BLACK);
        game.setupStone(5, 13, ColorUtils.WHITE);
        game.setupMoveCount(10);

        assertTrue(game.makeMove(9, 9, ColorUtils.WHITE));

        // east pair L10 M10 closed by N10 is the only capture
        assertEquals(1, game.captures(ColorUtils.WHITE));
        assertEquals(ColorUtils.BLACK, game.getCell(10, 9));
        assertEquals(ColorUtils.BLACK, game.getCell(11, 9));
        assertEquals(ColorUtils.BLACK, game.getCell(8, 10));
        assertEquals(ColorUtils.BLACK, game.getCell(6, 12));
    }

    @Test
    public void playingIntoABracketIsSafe() {
        // Given: O X _ O on row 10, black fills the gap itself
        Game game = BoardGenerator.fromStones("K10 N10", "L10 A1", ColorUtils.BLACK);
        game.setupMoveCount(5);

        // When
        assertTrue(game.makeMove(9, 11, ColorUtils.BLACK));

        // Then
        assertEquals(0, game.captures(ColorUtils.WHITE));
        assertEquals(ColorUtils.BLACK, game.getCell(9, 10));
        assertEquals(ColorUtils.BLACK, game.getCell(9, 11));
    }

    @ParameterizedTest
    @CsvSource({"0,1", "1,0", "1,1", "1,-1"})
    public void fiveInARowWins(int dr, int dc) {
        Game game = new Game();
        int[] blackCols = {0, 2, 4, 6, 8};
        int[] expected = new int[5];
        for (int i = 0; i < 5; i++) {
            assertEquals(ColorUtils.EMPTY, game.winner());
            int row = 5 + dr * i, col = 7 + dc * i;
            expected[i] = Move.asBytes(row, col);
            assertTrue(game.makeMove(row, col, ColorUtils.WHITE));
            if (i < 4) {
                assertTrue(game.makeMove(0, blackCols[i], ColorUtils.BLACK));
            }
        }

        assertEquals(ColorUtils.WHITE, game.winner());
        assertTrue(game.isOver());
        int[] sequence = game.winningSequence().toIntArray();
        assertEquals(5, sequence.length);
        Arrays.sort(sequence);
        Arrays.sort(expected);
        assertArrayEquals(expected, sequence);
    }

    @Test
    public void fourInARowIsNotAWin() {
        Game game = BoardGenerator.fromMoves("K10 A1 L10 A3 M10 A5 N10");
        assertEquals(ColorUtils.EMPTY, game.winner());
        assertTrue(game.winningSequence().isEmpty());
    }

    @Test
    public void fifthCapturedPairWins() {
        // Given: white already holds 4 pairs
        Game game = BoardGenerator.fromStones("N10", "L10 M10", ColorUtils.WHITE);
        game.setupCaptures(ColorUtils.WHITE, 4);

        // When
        game.makeMove(9, 9, ColorUtils.WHITE);

        // Then
        assertEquals(5, game.captures(ColorUtils.WHITE));
        assertEquals(ColorUtils.WHITE, game.winner());
        assertTrue(game.winningSequence().isEmpty(), "no line for a capture win");

        game.undoMove(9, 9);
        assertEquals(ColorUtils.EMPTY, game.winner());
        assertEquals(4, game.captures(ColorUtils.WHITE));
    }

    @Test
    public void undoClearsTheWinner() {
        Game game = BoardGenerator.fromMoves("K10 A1 L10 A3 M10 A5 N10 A7 O10");
        assertEquals(ColorUtils.WHITE, game.winner());

        game.undoMove(9, 13);

        assertEquals(ColorUtils.EMPTY, game.winner());
        assertTrue(game.winningSequence().isEmpty());
        assertEquals(Move.asBytes(6, 0), game.lastMove());
    }

    @Test
    public void makeThenUndoRestoresEverything() {
        Random random = new Random(42);
        Game game = new Game();
        IntArrayList candidates = new IntArrayList();

        for (int ply = 0; ply < 80 && game.winner() == ColorUtils.EMPTY; ply++) {
            byte color = game.currentPlayer();
            game.getCandidateMoves(1 + random.nextInt(2), candidates);

            // every candidate round-trips
            for (int i = 0; i < candidates.size(); i++) {
                int[] grid = game.gridSnapshot();
                int moveCount = game.moveCount();
                int white = game.captures(ColorUtils.WHITE);
                int black = game.captures(ColorUtils.BLACK);
                int depth = game.captureHistoryDepth();
                long key = game.zobristKey();
                int lastMove = game.lastMove();

                int mv = candidates.getInt(i);
                assertTrue(game.makeMove(mv, color));
                assertEquals(ZobristHashKeys.getHashKey(game), game.zobristKey());
                game.undoMove(mv);

                assertArrayEquals(grid, game.gridSnapshot());
                assertEquals(moveCount, game.moveCount());
                assertEquals(white, game.captures(ColorUtils.WHITE));
                assertEquals(black, game.captures(ColorUtils.BLACK));
                assertEquals(depth, game.captureHistoryDepth());
                assertEquals(key, game.zobristKey());
                assertEquals(lastMove, game.lastMove());
            }

            int chosen = candidates.getInt(random.nextInt(candidates.size()));
            game.makeMove(chosen, color);
            assertEquals(game.moveCount(), game.captureHistoryDepth());
        }

        // unwinding the whole game gives back an empty board
        while (game.captureHistoryDepth() > 0) {
            game.undoLastMove();
        }
        assertEquals(0, game.board().stoneCount());
        assertEquals(0, game.moveCount());
        assertEquals(0, game.captures(ColorUtils.WHITE));
        assertEquals(0, game.captures(ColorUtils.BLACK));
        assertEquals(0L, game.zobristKey());
        assertEquals(new Game(), game);
    }

    @Test
    public void copyIsIndependent() {
        Game game = BoardGenerator.fromMoves("K10 L10 K11");
        Game copy = game.copy();

        copy.makeMove(0, 0, ColorUtils.BLACK);
        copy.undoLastMove();
        copy.makeMove(18, 18, ColorUtils.BLACK);

        assertEquals(3, game.moveCount());
        assertEquals(ColorUtils.EMPTY, game.getCell(18, 18));
        assertEquals(4, copy.moveCount());
        assertNotEquals(game.zobristKey(), copy.zobristKey());
    }

    @Test
    public void tournamentRuleRestrictsTheOpeningMoves() {
        Game game = BoardGenerator.newTournamentGame();

        assertFalse(game.makeMove(3, 3, ColorUtils.WHITE), "first move must be the centre");
        assertTrue(game.makeMove(9, 9, ColorUtils.WHITE));
        assertTrue(game.makeMove(9, 10, ColorUtils.BLACK), "black is free");

        assertTrue(game.isTournamentRestricted());
        assertFalse(game.makeMove(11, 11, ColorUtils.WHITE), "distance 2 from the centre");
        IntArrayList candidates = game.getCandidateMoves(2);
        assertFalse(candidates.isEmpty());
        for (int i = 0; i < candidates.size(); i++) {
            int mv = candidates.getInt(i);
            assertEquals(3, BoardUtils.distanceFromCenter(Move.getRow(mv), Move.getCol(mv)));
            assertTrue(game.isValidMove(Move.getRow(mv), Move.getCol(mv), ColorUtils.WHITE));
        }
        assertTrue(game.makeMove(12, 9, ColorUtils.WHITE));
        assertFalse(game.isTournamentRestricted());
        assertTrue(game.makeMove(10, 10, ColorUtils.BLACK));
    }

    @Test
    public void withoutTournamentRuleAnyEmptyCellIsLegal() {
        Game game = new Game();
        assertTrue(game.makeMove(3, 3, ColorUtils.WHITE));
        assertTrue(game.makeMove(9, 10, ColorUtils.BLACK));
        assertTrue(game.makeMove(3, 4, ColorUtils.WHITE));
    }

    @Test
    public void emptyBoardHashesToZero() {
        assertEquals(0L, new Game().zobristKey());
        assertEquals(0L, ZobristHashKeys.getHashKey(new Game()));
    }
}
