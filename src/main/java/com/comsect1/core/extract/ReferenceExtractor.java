package com.comsect1.core.extract;

import com.comsect1.core.model.Reference;
import com.comsect1.core.model.SourceFile;

import java.util.List;

/**
 * Pulls line-level dependency references out of one source file.
 * Comment lines never yield references.
 */
public interface ReferenceExtractor {

    /**
     * @throws SourceReadException if the file cannot be read
     */
    List<Reference> extract(SourceFile file);
}
