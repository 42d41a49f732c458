package com.calor.analysis.effects;

/**
 * @param signature {@code Namespace.Type::Method(ParamTypes)}, {@code Namespace.Type::Method}
 *                  for every overload, or {@code Namespace.Type::*} for every member
 * @param source    file or resource the entry was read from
 */
public record CatalogEntry(String signature, EffectSet effects, CatalogLayer layer, String source) {}
