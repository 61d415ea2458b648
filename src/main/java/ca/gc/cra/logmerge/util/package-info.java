/** Small path helpers shared by adapters. */
package ca.gc.cra.logmerge.util;
