package se.alipsa.gotoimpl.core.service;

import se.alipsa.gotoimpl.core.model.Document;

import java.util.concurrent.CompletableFuture;

/**
 * Streaming implementation lookup. Definitions are reported to the context as they are found,
 * possibly from several threads; the returned future completes when the search is done.
 * Implementations should honour {@link FindUsagesContext#cancellationToken()}.
 */
@FunctionalInterface
public interface FindUsagesService {

  CompletableFuture<Void> findImplementations(Document document, int offset, FindUsagesContext context);
}
