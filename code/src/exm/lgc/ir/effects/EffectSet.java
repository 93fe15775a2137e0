/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.lgc.ir.effects;

import java.util.Collection;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import exm.lgc.common.lang.Var;

/**
 * Immutable summary of the side effects of a statement, expression or
 * function.
 *
 * Sets only grow under {@link #join(EffectSet)}.  An unknown effect may read
 * and write any binding.
 */
public class EffectSet {
  public static final EffectSet PURE = new Builder().build();
  public static final EffectSet UNKNOWN = new Builder().unknown().build();

  private final ImmutableSet<Var> reads;
  private final ImmutableSet<Var> writes;
  private final ImmutableSet<Var> consumes;
  /** Subset of writes that commute with each other */
  private final ImmutableSet<Var> commutativeWrites;
  private final boolean alloc;
  private final boolean io;
  private final boolean securityCheck;
  private final boolean diverge;
  private final boolean unknown;

  private EffectSet(Builder b) {
    this.reads = ImmutableSet.copyOf(b.reads);
    this.writes = ImmutableSet.copyOf(b.writes);
    this.consumes = ImmutableSet.copyOf(b.consumes);
    this.commutativeWrites = ImmutableSet.copyOf(b.commutativeWrites);
    this.alloc = b.alloc;
    this.io = b.io;
    this.securityCheck = b.securityCheck;
    this.diverge = b.diverge;
    this.unknown = b.unknown;
  }

  public static EffectSet read(Var ...vars) {
    Builder b = new Builder();
    for (Var v: vars) {
      b.read(v);
    }
    return b.build();
  }

  public static EffectSet write(Var ...vars) {
    Builder b = new Builder();
    for (Var v: vars) {
      b.write(v);
    }
    return b.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder().join(this);
  }

  /**
   * Project onto the lattice: the greatest kind present
   */
  public EffectKind kind() {
    if (unknown) {
      return EffectKind.UNKNOWN;
    } else if (diverge) {
      return EffectKind.DIVERGE;
    } else if (securityCheck) {
      return EffectKind.SECURITY_CHECK;
    } else if (io) {
      return EffectKind.IO;
    } else if (alloc) {
      return EffectKind.ALLOC;
    } else if (!consumes.isEmpty()) {
      return EffectKind.CONSUME;
    } else if (!writes.isEmpty()) {
      return EffectKind.WRITE;
    } else if (!reads.isEmpty()) {
      return EffectKind.READ;
    } else {
      return EffectKind.PURE;
    }
  }

  public EffectSet join(EffectSet other) {
    if (other == this || other.leq(this)) {
      return this;
    } else if (this.leq(other)) {
      return other;
    }
    return toBuilder().join(other).build();
  }

  /**
   * Partial order of the aggregate: every component is included in other's
   */
  public boolean leq(EffectSet other) {
    return other.reads.containsAll(reads) &&
           other.writes.containsAll(writes) &&
           other.consumes.containsAll(consumes) &&
           other.commutativeWrites.containsAll(commutativeWrites) &&
           (!alloc || other.alloc) &&
           (!io || other.io) &&
           (!securityCheck || other.securityCheck) &&
           (!diverge || other.diverge) &&
           (!unknown || other.unknown);
  }

  public Set<Var> reads() {
    return reads;
  }

  public Set<Var> writes() {
    return writes;
  }

  public Set<Var> consumes() {
    return consumes;
  }

  public Set<Var> commutativeWrites() {
    return commutativeWrites;
  }

  public boolean allocates() {
    return alloc;
  }

  public boolean hasIO() {
    return io;
  }

  public boolean hasSecurityCheck() {
    return securityCheck;
  }

  public boolean mayDiverge() {
    return diverge;
  }

  public boolean isUnknown() {
    return unknown;
  }

  public boolean mayRead(Var v) {
    return unknown || reads.contains(v);
  }

  /**
   * @return true if v may be modified, moved from or rebound
   */
  public boolean mayWrite(Var v) {
    return unknown || writes.contains(v) || consumes.contains(v);
  }

  public boolean mayWriteAny(Collection<Var> vars) {
    if (unknown) {
      return true;
    }
    for (Var v: vars) {
      if (writes.contains(v) || consumes.contains(v)) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return bindings modified or moved from.  Meaningless if unknown
   */
  public Set<Var> writesAndConsumes() {
    return Sets.union(writes, consumes);
  }

  @Override
  public int hashCode() {
    int h = reads.hashCode();
    h = h * 31 + writes.hashCode();
    h = h * 31 + consumes.hashCode();
    h = h * 31 + commutativeWrites.hashCode();
    h = h * 2 + (alloc ? 1 : 0);
    h = h * 2 + (io ? 1 : 0);
    h = h * 2 + (securityCheck ? 1 : 0);
    h = h * 2 + (diverge ? 1 : 0);
    h = h * 2 + (unknown ? 1 : 0);
    return h;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof EffectSet)) {
      return false;
    }
    EffectSet o = (EffectSet)obj;
    return reads.equals(o.reads) && writes.equals(o.writes) &&
           consumes.equals(o.consumes) &&
           commutativeWrites.equals(o.commutativeWrites) &&
           alloc == o.alloc && io == o.io &&
           securityCheck == o.securityCheck &&
           diverge == o.diverge && unknown == o.unknown;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind().toString());
    sb.append("{");
    if (!reads.isEmpty()) {
      sb.append(" reads=").append(reads);
    }
    if (!writes.isEmpty()) {
      sb.append(" writes=").append(writes);
    }
    if (!consumes.isEmpty()) {
      sb.append(" consumes=").append(consumes);
    }
    if (!commutativeWrites.isEmpty()) {
      sb.append(" commutative=").append(commutativeWrites);
    }
    if (alloc) sb.append(" alloc");
    if (io) sb.append(" io");
    if (securityCheck) sb.append(" check");
    if (diverge) sb.append(" diverge");
    if (unknown) sb.append(" unknown");
    sb.append(" }");
    return sb.toString();
  }

  /**
   * Accumulates effects while classifying a subtree
   */
  public static class Builder {
    private final Set<Var> reads = Sets.newLinkedHashSet();
    private final Set<Var> writes = Sets.newLinkedHashSet();
    private final Set<Var> consumes = Sets.newLinkedHashSet();
    private final Set<Var> commutativeWrites = Sets.newLinkedHashSet();
    private boolean alloc = false;
    private boolean io = false;
    private boolean securityCheck = false;
    private boolean diverge = false;
    private boolean unknown = false;

    public Builder read(Var v) {
      reads.add(v);
      return this;
    }

    public Builder write(Var v) {
      writes.add(v);
      return this;
    }

    public Builder commutativeWrite(Var v) {
      writes.add(v);
      commutativeWrites.add(v);
      return this;
    }

    public Builder consume(Var v) {
      consumes.add(v);
      return this;
    }

    public Builder alloc() {
      alloc = true;
      return this;
    }

    public Builder io() {
      io = true;
      return this;
    }

    public Builder securityCheck() {
      securityCheck = true;
      return this;
    }

    public Builder diverge() {
      diverge = true;
      return this;
    }

    public Builder unknown() {
      unknown = true;
      return this;
    }

    public Builder join(EffectSet e) {
      reads.addAll(e.reads);
      writes.addAll(e.writes);
      consumes.addAll(e.consumes);
      commutativeWrites.addAll(e.commutativeWrites);
      alloc |= e.alloc;
      io |= e.io;
      securityCheck |= e.securityCheck;
      diverge |= e.diverge;
      unknown |= e.unknown;
      return this;
    }

    public EffectSet build() {
      return new EffectSet(this);
    }
  }
}
