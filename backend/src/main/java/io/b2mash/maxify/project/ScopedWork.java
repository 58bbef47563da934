package io.b2mash.maxify.project;

@FunctionalInterface
public interface ScopedWork<T> {

  T execute(TransactionScope scope);
}
