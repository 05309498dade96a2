package com.cliffc.lir;

import com.cliffc.lir.ir.ItemId;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/** Registry of declared items, mapping an ItemId back to its declared name.
 *
 *  Printers find the registry through a per-thread "current program"
 *  binding instead of threading a Program through every call.  A caller
 *  installs a Program for the dynamic extent of a closure; the prior binding
 *  is restored on every exit path, so installs nest and the innermost wins.
 */
public class Program {
  private final HashMap<ItemId,TypeKind> _type_kinds = new HashMap<>();
  private final ArrayList<ItemId> _items = new ArrayList<>(); // Declaration order
  private int _next;            // Next free ItemId index

  // Register a declared item under a given id
  public Program add( @NotNull ItemId id, @NotNull TypeKind kind ) {
    assert !_type_kinds.containsKey(id) : "Duplicate item "+id._index;
    _type_kinds.put(id,kind);
    _items.add(id);
    _next = Math.max(_next,id._index+1);
    return this;
  }
  // Register with a fresh id
  public ItemId add_struct( String name, int binders ) { return add_fresh(new TypeKind(TypeKind.Sort.STRUCT,name,binders)); }
  public ItemId add_trait ( String name, int binders ) { return add_fresh(new TypeKind(TypeKind.Sort.TRAIT ,name,binders)); }
  private ItemId add_fresh( TypeKind kind ) {
    ItemId id = new ItemId(_next);
    add(id,kind);
    return id;
  }

  public TypeKind type_kind( ItemId id ) { return _type_kinds.get(id); }
  public String name_of( ItemId id ) {
    TypeKind k = _type_kinds.get(id);
    return k==null ? null : k._name;
  }
  public List<ItemId> items() { return Collections.unmodifiableList(_items); }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("Program{");
    for( ItemId id : _items ) sb.append(' ').append(id._index).append('=').append(_type_kinds.get(id));
    return sb.append(" }").toString();
  }

  // ----------------------------------------------------------
  private static final ThreadLocal<Program> CURRENT = new ThreadLocal<>();

  // Call f with the current program, or null if none is installed
  public static <R> R with_current_program( @NotNull Function<Program,R> f ) { return f.apply(CURRENT.get()); }

  // Install prog for the extent of f; the prior binding comes back on exit,
  // normal or exceptional.
  public static <R> R set_current_program( Program prog, @NotNull Supplier<R> f ) {
    Program old = CURRENT.get();
    CURRENT.set(prog);
    LIR.p(prog,"install "+prog);
    try {
      return f.get();
    } finally {
      if( old==null ) CURRENT.remove();
      else CURRENT.set(old);
      LIR.p(old,"restore "+old);
    }
  }
}
