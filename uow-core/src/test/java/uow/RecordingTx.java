package uow;

import uow.spi.Tx;

import java.util.List;

class RecordingTx implements Tx {
  private final String name;
  private final List<String> journal;
  private final Exception commitFailure;
  private final Exception rollbackFailure;
  int commitCount;
  int rollbackCount;

  RecordingTx(String name, List<String> journal, Exception commitFailure, Exception rollbackFailure) {
    this.name = name;
    this.journal = journal;
    this.commitFailure = commitFailure;
    this.rollbackFailure = rollbackFailure;
  }

  String value() {
    return "tx " + name;
  }

  @Override
  public void commit() throws Exception {
    commitCount++;
    journal.add("commit:" + name);
    if (commitFailure != null) {
      throw commitFailure;
    }
  }

  @Override
  public void rollback() throws Exception {
    rollbackCount++;
    journal.add("rollback:" + name);
    if (rollbackFailure != null) {
      throw rollbackFailure;
    }
  }

  @Override
  public String toString() {
    return "RecordingTx[" + name + "]";
  }
}
