package com.ospicorp.tides.tide.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, validated set of tidal constituents used as fixed design frequencies. Names are unique
 * (case insensitive) and every speed is positive.
 */
public record ConstituentCatalogue(List<Constituent> constituents) {

  public ConstituentCatalogue {
    constituents = List.copyOf(constituents);
    Set<String> seen = new HashSet<>();
    for (Constituent c : constituents) {
      if (!seen.add(c.name().toUpperCase(Locale.ROOT))) {
        throw new IllegalArgumentException("Duplicate constituent in catalogue: " + c.name());
      }
    }
  }

  public int size() {
    return constituents.size();
  }

  public boolean isEmpty() {
    return constituents.isEmpty();
  }

  public Constituent slowest() {
    Constituent slowest = null;
    for (Constituent c : constituents) {
      if (slowest == null || c.speed() < slowest.speed()) {
        slowest = c;
      }
    }
    return slowest;
  }

  /**
   * Sub-catalogue with the named constituents, keeping catalogue order.
   *
   * @throws IllegalArgumentException if a name is not in the catalogue
   */
  public ConstituentCatalogue select(Collection<String> names) {
    Map<String, Constituent> byName = new LinkedHashMap<>();
    for (Constituent c : constituents) {
      byName.put(c.name().toUpperCase(Locale.ROOT), c);
    }
    Set<String> wanted = new HashSet<>();
    for (String name : names) {
      String key = name.trim().toUpperCase(Locale.ROOT);
      if (!byName.containsKey(key)) {
        throw new IllegalArgumentException("Unknown constituent: " + name);
      }
      wanted.add(key);
    }
    List<Constituent> out = new ArrayList<>();
    for (var e : byName.entrySet()) {
      if (wanted.contains(e.getKey())) {
        out.add(e.getValue());
      }
    }
    return new ConstituentCatalogue(out);
  }

  /**
   * Constituents that a record of the given length can resolve: the period fits in the span and
   * the speed differs from every constituent kept before it by at least one cycle over the span
   * (Rayleigh criterion). Earlier catalogue entries win.
   */
  public ConstituentCatalogue resolvableOver(Duration span) {
    double hours = span.toSeconds() / 3600d;
    if (hours <= 0d) {
      return new ConstituentCatalogue(List.of());
    }
    double minSeparation = 360d / hours;
    List<Constituent> kept = new ArrayList<>();
    for (Constituent c : constituents) {
      if (c.periodHours() > hours) {
        continue;
      }
      boolean separated = true;
      for (Constituent k : kept) {
        if (Math.abs(k.speed() - c.speed()) < minSeparation) {
          separated = false;
          break;
        }
      }
      if (separated) {
        kept.add(c);
      }
    }
    return new ConstituentCatalogue(kept);
  }
}
