package se.alipsa.gotoimpl.core.service;

import se.alipsa.gotoimpl.core.host.CancellationToken;
import se.alipsa.gotoimpl.core.model.Document;

/**
 * One-shot implementation lookup. Blocks until done and is free to navigate by itself,
 * e.g. when it finds exactly one implementation.
 */
@FunctionalInterface
public interface GoToImplementationService {

  GoToImplementationResult tryGoToImplementation(Document document, int offset, CancellationToken cancellationToken);
}
