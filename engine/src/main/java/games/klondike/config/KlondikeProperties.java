package games.klondike.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the console game.
 *
 * These settings only affect the application around the engine: whether a console session
 * starts, how the board is drawn and how the deck is shuffled before the deal.
 *
 * Usage:
 * {@code java -jar engine.jar --klondike.seed=42 --klondike.colour=false}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "klondike")
public class KlondikeProperties {
  private boolean interactive = true;
  private boolean colour = true;
  private Long seed;
  private boolean showBoardAfterMove = true;

  /**
   * Returns whether a console session is started when the application runs.
   * @return true to read commands from stdin on startup
   */
  public boolean isInteractive() {
    return interactive;
  }

  public void setInteractive(boolean interactive) {
    this.interactive = interactive;
  }

  /**
   * Returns whether red cards are drawn with ANSI colour codes.
   * @return true if the board is coloured
   */
  public boolean isColour() {
    return colour;
  }

  public void setColour(boolean colour) {
    this.colour = colour;
  }

  /**
   * Returns the shuffle seed, or null for a different deal on every run.
   * @return the seed, may be null
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Returns whether the console redraws the board after every accepted move.
   * @return true to redraw after each move
   */
  public boolean isShowBoardAfterMove() {
    return showBoardAfterMove;
  }

  public void setShowBoardAfterMove(boolean showBoardAfterMove) {
    this.showBoardAfterMove = showBoardAfterMove;
  }
}
