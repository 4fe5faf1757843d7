/// Module for the HashVec library: an insertion-ordered hash map whose entries are also addressable by position.
module com.github.simbo1905.hashvec {
  requires java.logging;
  requires static lombok;
  requires static org.jetbrains.annotations;
  exports com.github.simbo1905.hashvec;
}
