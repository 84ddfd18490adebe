/**
 * Perceptual hashing (average, difference, frequency) and Hamming-distance similarity.
 */
package com.phillippitts.batchanalyzer.service.hash;
