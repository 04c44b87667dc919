package com.cliffc.lc;

// Reduction ran out of budget before reaching a normal form.  The term may
// diverge, or its normal form may just be too far away.
public class StepLimit extends RuntimeException {
  public final int _steps;      // Beta steps taken before giving up
  public final int _max_steps;  // The budget
  StepLimit( int steps, int max_steps, String why ) {
    super(why+" after "+steps+" beta steps, budget "+max_steps);
    _steps = steps;
    _max_steps = max_steps;
  }
}
