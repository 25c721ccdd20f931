package ca.gc.cra.swarm.domain.protocol;

import java.util.OptionalLong;

/**
 * Game action sent once a player is registered.
 *
 * <p>The wire form always carries {@code "action"}; {@code "amount"} is present for bets and folds only.
 * A fold is encoded as a bet with a negative amount.</p>
 *
 * @since 0.1.0
 */
public sealed interface Action extends Request permits Action.Join, Action.Bet, Action.Fold {
  /** Amount written on the wire for a fold. */
  long FOLD_AMOUNT = -1L;

  /**
   * Returns the {@code action} verb written on the wire.
   *
   * @return {@code "join"} or {@code "bet"}
   */
  String verb();

  /**
   * Returns the {@code amount} written on the wire, if any.
   *
   * @return amount for bets and folds; empty for joins
   */
  OptionalLong wireAmount();

  static Action join() {
    return Join.INSTANCE;
  }

  static Action bet(long amount) {
    return new Bet(amount);
  }

  static Action fold() {
    return Fold.INSTANCE;
  }

  /** Requests a seat at the next available table. */
  record Join() implements Action {
    private static final Join INSTANCE = new Join();

    @Override
    public String verb() {
      return "join";
    }

    @Override
    public OptionalLong wireAmount() {
      return OptionalLong.empty();
    }
  }

  /**
   * Places a bet of {@code amount} chips.
   *
   * @param amount non-negative chip count
   */
  record Bet(long amount) implements Action {
    public Bet {
      if (amount < 0) {
        throw new IllegalArgumentException("bet amount must be >= 0 (use fold)");
      }
    }

    @Override
    public String verb() {
      return "bet";
    }

    @Override
    public OptionalLong wireAmount() {
      return OptionalLong.of(amount);
    }
  }

  /** Gives up the current hand. */
  record Fold() implements Action {
    private static final Fold INSTANCE = new Fold();

    @Override
    public String verb() {
      return "bet";
    }

    @Override
    public OptionalLong wireAmount() {
      return OptionalLong.of(FOLD_AMOUNT);
    }
  }
}
