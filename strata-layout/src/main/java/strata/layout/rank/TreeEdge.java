package strata.layout.rank;

public class TreeEdge {
  double cutvalue;

  public TreeEdge() {
  }

  public TreeEdge(double cutvalue) {
    this.cutvalue = cutvalue;
  }

  public double cutvalue() {
    return cutvalue;
  }

  public TreeEdge setCutvalue(double cutvalue) {
    this.cutvalue = cutvalue;
    return this;
  }
}
