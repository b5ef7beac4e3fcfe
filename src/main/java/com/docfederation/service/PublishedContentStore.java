package com.docfederation.service;

import com.docfederation.model.docs.DocumentNode;
import com.docfederation.model.docs.PublishedRepository;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rewritten documents and navigation of every namespace, as served by the site.
 * Each namespace is replaced as a whole; readers never see a mix of two syncs.
 */
public interface PublishedContentStore {

    /**
     * Replaces the namespace {@code manifest.slug()} with the given documents
     * and the listed assets copied from {@code assetRoot}.
     *
     * <p>The new version is live when this returns. The previous one is kept
     * until the returned publication is confirmed or rolled back.
     */
    Publication publish(PublishedRepository manifest, List<DocumentNode> documents, Path assetRoot, List<String> assets);

    Optional<PublishedRepository> find(String slug);

    /**
     * Current manifests keyed by slug.
     */
    Map<String, PublishedRepository> snapshot();

    /**
     * Removes a namespace. No-op when it was never published.
     */
    void purge(String slug);

    /**
     * A namespace swap that can still be undone.
     */
    interface Publication {

        /**
         * Discards the previous version.
         */
        void confirm();

        /**
         * Puts the previous version back, or removes the namespace when it
         * had never been published.
         */
        void rollback();
    }
}
