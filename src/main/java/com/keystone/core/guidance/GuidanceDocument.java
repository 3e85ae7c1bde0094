package com.keystone.core.guidance;

import com.keystone.core.document.ManagedDocumentMerger;
import com.keystone.core.document.MergeResult;
import com.keystone.core.model.Blueprint;
import com.keystone.core.pack.TemplatePack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates and refreshes the agent guidance document. Only managed regions are ever
 * rewritten; the skeleton written at creation time belongs to the user afterwards.
 */
@Service
public class GuidanceDocument {

    private static final Logger log = LoggerFactory.getLogger(GuidanceDocument.class);

    private final ManagedDocumentMerger merger;

    public GuidanceDocument(ManagedDocumentMerger merger) {
        this.merger = merger;
    }

    /** A new document: the user-owned skeleton followed by every region of the pack. */
    public String create(Blueprint blueprint, TemplatePack pack) {
        return merger.merge(skeleton(blueprint), pack.renderRegions(blueprint));
    }

    /**
     * Regenerates the regions of an existing document.
     *
     * @throws com.keystone.core.document.MalformedDocumentException if its markers are broken
     */
    public MergeResult update(String existing, Blueprint blueprint, TemplatePack pack) {
        MergeResult result = merger.mergeDetailed(existing, pack.renderRegions(blueprint));
        log.info("Guidance regions: {} replaced, {} appended, {} left as-is",
                result.replaced().size(), result.appended().size(), result.preserved().size());
        return result;
    }

    String skeleton(Blueprint blueprint) {
        var sb = new StringBuilder();
        sb.append("# ").append(blueprint.project().name()).append("\n\n");
        sb.append(blueprint.project().description()).append("\n\n");
        sb.append("Guidance for coding agents working on this project. Sections between `")
          .append(merger.markers().namespace())
          .append("` markers are regenerated from `keystone.blueprint.json` by `keystone update-guide`; ")
          .append("edit anything outside them freely.\n\n");
        sb.append("## Project Notes\n\n");
        sb.append("_Add conventions, domain vocabulary and gotchas here._\n");
        return sb.toString();
    }
}
