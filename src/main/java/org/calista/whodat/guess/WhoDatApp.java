package org.calista.whodat.guess;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.whodat.guess.core.GameKernel;
import org.calista.whodat.guess.game.Answer;
import org.calista.whodat.guess.game.Candidate;
import org.calista.whodat.guess.game.InvalidAnswerException;
import org.calista.whodat.guess.session.GameSessions;
import org.calista.whodat.guess.session.SessionNotFoundException;
import org.calista.whodat.guess.session.SessionTurn;
import org.calista.whodat.guess.state.Phase;
import org.calista.whodat.guess.state.StateCorruptException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Scanner;

/**
 * WhoDatApp — interactive console runner.
 *
 * Lifecycle:
 *  1) build kernel (config + catalog; a broken catalog aborts here)
 *  2) play games through the session boundary until "exit"
 */
public final class WhoDatApp {

    private static final Logger log = LogManager.getLogger(WhoDatApp.class);

    private final Path cfgPath;
    private GameKernel kernel;

    public static void main(String[] args) throws Exception {
        Path cfg = args.length > 0 ? Path.of(args[0]) : Path.of("config/config.json");
        new WhoDatApp(cfg).run();
    }

    public WhoDatApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    public void run() throws IOException {
        kernel = GameKernel.builder()
                .configRoot(Path.of("."))
                .build(cfgPath);

        int evicted = kernel.sessions().evictIdle();
        if (evicted > 0) log.info("Startup eviction removed {} idle session(s)", evicted);

        log.info("Who Dat? started. entities={}, questions={}",
                kernel.catalog().entityCount(), kernel.catalog().questionCount());
        System.out.println("Think of someone. Answers: " + String.join(" / ", Answer.labels()) + ". Type 'exit' to quit.\n");

        try (Scanner sc = new Scanner(System.in)) {
            boolean again = true;
            while (again) {
                again = playOne(sc);
            }
        }
        System.out.println("Bye.");
    }

    /**
     * @return false when the player asked to exit
     */
    private boolean playOne(Scanner sc) throws IOException {
        GameSessions sessions = kernel.sessions();
        SessionTurn t = sessions.start();

        while (true) {
            System.out.println("\n" + t.message);
            if (t.turn.isFinished()) {
                printTop(t);
                return ask(sc, "Play again? (y/n) ").startsWith("y");
            }

            String input = ask(sc, t.turn.status == Phase.GUESSING ? "(y/n) > " : "> ");
            if (input.equals("exit")) return false;

            t = step(sessions, t, input);
        }
    }

    /**
     * Applies one line of player input. A rejected answer keeps the current turn;
     * an expired or unreadable session starts a new game.
     */
    static SessionTurn step(GameSessions sessions, SessionTurn t, String input) throws IOException {
        try {
            if (t.turn.status == Phase.GUESSING) {
                return sessions.confirm(t.sessionId, t.turn.guess.id, input.startsWith("y"));
            }
            return sessions.answer(t.sessionId, t.turn.question.attributeKey, input);
        } catch (InvalidAnswerException e) {
            System.out.println(e.getMessage());
            return t;
        } catch (SessionNotFoundException e) {
            log.warn("Session {} expired, starting over", t.sessionId);
            System.out.println("That game timed out. Starting a new one.");
            return sessions.start();
        } catch (StateCorruptException e) {
            log.warn("Session {} could not be restored, starting over: {}", t.sessionId, e.getMessage());
            return sessions.start();
        }
    }

    private static String ask(Scanner sc, String prompt) {
        System.out.print(prompt);
        if (!sc.hasNextLine()) return "exit";
        return sc.nextLine().trim().toLowerCase(Locale.ROOT);
    }

    private static void printTop(SessionTurn t) {
        for (Candidate c : t.turn.topCandidates) {
            System.out.println("  " + c);
        }
    }

    public GameKernel getKernel() { return kernel; }

    public Path getCfgPath() { return cfgPath; }
}
