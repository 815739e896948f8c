package com.boqregistry.classification.similarity;

import com.boqregistry.domain.BoqItem;

/**
 * @param similarity 0..100
 */
public record SimilarItemMatch(BoqItem item, int similarity) {
}
