package com.cliffc.lc;

import com.cliffc.lc.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Set;

/** Untyped lambda-calculus terms.

 * Exactly three kinds: a variable {@link Var}, a single-argument abstraction
 * {@link Lam} and an application {@link App}.  The only constructor is
 * private, so nothing outside this file can add a fourth kind.

 * Terms are immutable; all transformations build new Terms and sharing
 * sub-terms is always safe.  Names are plain Strings compared with equals().
 * The hash is computed once at construction.
 */
public abstract class Term {
  // Prepended to a seed name until it is no longer free
  public static final char MARK = '\'';

  final int _hash;
  private Term( int hash ) { _hash = hash; }

  // --- Structural operations ------------------------

  /** @return a fresh set of the names occurring free in this term */
  public abstract Set<String> free_vars();

  /** @return true if {@code name} occurs free in this term; same as
   *  {@code free_vars().contains(name)} without building the set */
  public abstract boolean occurs_free( String name );

  // Count of nodes
  public abstract int size();

  /** Deterministic fresh name.  Prepends {@link #MARK} to {@code seed}
   *  until the result is not free in {@code t}.  Terminates because the
   *  free set is finite.
   *  @param seed name to start from
   *  @param t    term whose free names are avoided
   *  @return seed, or seed with some number of leading marks */
  public static @NotNull String fresh( @NotNull String seed, @NotNull Term t ) {
    Set<String> fvs = t.free_vars();
    String s = seed;
    while( fvs.contains(s) ) s = MARK+s;
    return s;
  }

  /** Alpha-equivalence: same shape, bound names matched by binding depth,
   *  free names matched by name. */
  public final boolean alpha_eq( Term t ) {
    return _alpha(t,new HashMap<>(),new HashMap<>(),0);
  }
  abstract boolean _alpha( Term t, HashMap<String,Integer> lhs, HashMap<String,Integer> rhs, int depth );

  // Debug printing.  Not the concrete syntax: lambdas print as { x y -> body },
  // applications as (f a b).
  @Override public final String toString() { return str(new SB()).toString(); }
  public abstract SB str( SB sb );

  @Override public final int hashCode() { return _hash; }

  // --- Var ------------------------
  public static final class Var extends Term {
    public final String _name;
    public Var( @NotNull String name ) { super(name.hashCode()); _name = name; }
    @Override public Set<String> free_vars() {
      HashSet<String> fvs = new HashSet<>();
      fvs.add(_name);
      return fvs;
    }
    @Override public boolean occurs_free( String name ) { return _name.equals(name); }
    @Override public int size() { return 1; }
    @Override boolean _alpha( Term t, HashMap<String,Integer> lhs, HashMap<String,Integer> rhs, int depth ) {
      if( !(t instanceof Var v) ) return false;
      Integer l = lhs.get(_name), r = rhs.get(v._name);
      if( l==null && r==null ) return _name.equals(v._name); // Both free
      return l!=null && l.equals(r);                          // Both bound at same depth
    }
    @Override public SB str( SB sb ) { return sb.p(_name); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof Var v && _name.equals(v._name));
    }
  }

  // --- Lam ------------------------
  public static final class Lam extends Term {
    public final String _name;  // Bound name
    public final Term _body;
    public Lam( @NotNull String name, @NotNull Term body ) {
      super(name.hashCode()*31+body._hash+0x1A3B);
      _name = name;
      _body = body;
    }
    @Override public Set<String> free_vars() {
      Set<String> fvs = _body.free_vars();
      fvs.remove(_name);
      return fvs;
    }
    @Override public boolean occurs_free( String name ) {
      return !_name.equals(name) && _body.occurs_free(name);
    }
    @Override public int size() { return 1+_body.size(); }
    @Override boolean _alpha( Term t, HashMap<String,Integer> lhs, HashMap<String,Integer> rhs, int depth ) {
      if( !(t instanceof Lam lam) ) return false;
      // Push the binders, check the bodies, pop the binders
      Integer l = lhs.put(_name,depth);
      Integer r = rhs.put(lam._name,depth);
      boolean eq = _body._alpha(lam._body,lhs,rhs,depth+1);
      restore(lhs,_name,l);
      restore(rhs,lam._name,r);
      return eq;
    }
    private static void restore( HashMap<String,Integer> map, String name, Integer old ) {
      if( old==null ) map.remove(name);
      else map.put(name,old);
    }
    @Override public SB str( SB sb ) {
      sb.p("{ ");
      Term t = this;
      while( t instanceof Lam lam ) {
        sb.p(lam._name).p(' ');
        t = lam._body;
      }
      return t.str(sb.p("-> ")).p(" }");
    }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      if( !(o instanceof Lam lam) || _hash!=lam._hash ) return false;
      return _name.equals(lam._name) && _body.equals(lam._body);
    }
  }

  // --- App ------------------------
  public static final class App extends Term {
    public final Term _fun, _arg;
    public App( @NotNull Term fun, @NotNull Term arg ) {
      super(fun._hash*37+arg._hash+0x5C1D);
      _fun = fun;
      _arg = arg;
    }
    @Override public Set<String> free_vars() {
      Set<String> fvs = _fun.free_vars();
      fvs.addAll(_arg.free_vars());
      return fvs;
    }
    @Override public boolean occurs_free( String name ) {
      return _fun.occurs_free(name) || _arg.occurs_free(name);
    }
    @Override public int size() { return 1+_fun.size()+_arg.size(); }
    @Override boolean _alpha( Term t, HashMap<String,Integer> lhs, HashMap<String,Integer> rhs, int depth ) {
      return t instanceof App app &&
        _fun._alpha(app._fun,lhs,rhs,depth) &&
        _arg._alpha(app._arg,lhs,rhs,depth);
    }
    // Left spine prints flat: (f a b)
    @Override public SB str( SB sb ) {
      sb.p('(');
      _spine(sb);
      return sb.p(')');
    }
    private void _spine( SB sb ) {
      if( _fun instanceof App app ) app._spine(sb);
      else _fun.str(sb);
      _arg.str(sb.p(' '));
    }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      if( !(o instanceof App app) || _hash!=app._hash ) return false;
      return _fun.equals(app._fun) && _arg.equals(app._arg);
    }
  }
}
