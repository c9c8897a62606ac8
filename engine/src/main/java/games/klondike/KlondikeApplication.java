package games.klondike;

import games.klondike.config.KlondikeProperties;
import games.klondike.console.ConsoleSession;
import games.klondike.game.Deck;
import games.klondike.game.KlondikeGame;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KlondikeApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(KlondikeApplication.class);

    private final KlondikeProperties properties;

    public KlondikeApplication(KlondikeProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(KlondikeApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        if (!properties.isInteractive()) {
            log.info("Interactive console disabled (klondike.interactive=false)");
            return;
        }
        KlondikeGame game = newGame();
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new ConsoleSession(game, in, System.out, properties).run();
    }

    /**
     * Shuffles a new deck, seeded when {@code klondike.seed} is set, and deals from it.
     */
    KlondikeGame newGame() {
        Long seed = properties.getSeed();
        Deck deck = seed == null ? new Deck() : new Deck(new Random(seed));
        if (seed != null && log.isDebugEnabled()) {
            log.debug("Dealing with seed {}", seed);
        }
        return new KlondikeGame(deck);
    }
}
