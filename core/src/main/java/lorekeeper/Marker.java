package lorekeeper;

/**
 * Gives Weld a class at the root of the package tree to scan from when every module is bundled into one JAR.
 */
public class Marker {
}
