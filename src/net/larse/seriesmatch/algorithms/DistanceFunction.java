package net.larse.seriesmatch.algorithms;

import net.larse.seriesmatch.features.FeatureSequence;

/** Local cost between element i of one sequence and element j of another. */
public interface DistanceFunction {
  DistanceFunction EUCLIDEAN = (x, i, y, j) -> x.get(i).euclideanDistance(y.get(j));

  double calcDistance(FeatureSequence x, int i, FeatureSequence y, int j);
}
