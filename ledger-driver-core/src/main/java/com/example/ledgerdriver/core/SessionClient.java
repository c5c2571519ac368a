package com.example.ledgerdriver.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.util.List;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.qldbsession.QldbSessionClient;
import software.amazon.awssdk.services.qldbsession.model.AbortTransactionRequest;
import software.amazon.awssdk.services.qldbsession.model.CommitTransactionRequest;
import software.amazon.awssdk.services.qldbsession.model.CommitTransactionResult;
import software.amazon.awssdk.services.qldbsession.model.EndSessionRequest;
import software.amazon.awssdk.services.qldbsession.model.ExecuteStatementRequest;
import software.amazon.awssdk.services.qldbsession.model.ExecuteStatementResult;
import software.amazon.awssdk.services.qldbsession.model.FetchPageRequest;
import software.amazon.awssdk.services.qldbsession.model.FetchPageResult;
import software.amazon.awssdk.services.qldbsession.model.SendCommandRequest;
import software.amazon.awssdk.services.qldbsession.model.SendCommandResponse;
import software.amazon.awssdk.services.qldbsession.model.StartSessionRequest;
import software.amazon.awssdk.services.qldbsession.model.StartTransactionRequest;
import software.amazon.awssdk.services.qldbsession.model.StartTransactionResult;
import software.amazon.awssdk.services.qldbsession.model.ValueHolder;

/**
 * One remote session: a session token plus the low level client, exposing the endpoint's commands
 * as methods. Errors are the SDK exceptions thrown by {@code SendCommand}, unchanged.
 */
final class SessionClient {

  private static final System.Logger LOGGER = System.getLogger(SessionClient.class.getName());

  private final String ledgerName;
  private final String token;
  private final String id;
  private final QldbSessionClient client;

  private SessionClient(
      final String ledgerName, final String token, final String id, final QldbSessionClient client) {
    this.ledgerName = ledgerName;
    this.token = token;
    this.id = id;
    this.client = client;
  }

  /**
   * Starts a new session on the ledger.
   *
   * @param ledgerName ledger to connect to
   * @param client low level client
   * @return the started session
   */
  static SessionClient start(final String ledgerName, final QldbSessionClient client) {
    LOGGER.log(DEBUG, "Initiating new session on ledger {0}", ledgerName);
    final var request =
        SendCommandRequest.builder()
            .startSession(StartSessionRequest.builder().ledgerName(ledgerName).build())
            .build();
    final var response = client.sendCommand(request);
    final var sessionId =
        response.responseMetadata() == null ? null : response.responseMetadata().requestId();
    return new SessionClient(ledgerName, response.startSession().sessionToken(), sessionId, client);
  }

  String ledgerName() {
    return ledgerName;
  }

  String token() {
    return token;
  }

  String id() {
    return id;
  }

  StartTransactionResult startTransaction() {
    return send(
            SendCommandRequest.builder()
                .sessionToken(token)
                .startTransaction(StartTransactionRequest.builder().build())
                .build())
        .startTransaction();
  }

  ExecuteStatementResult executeStatement(
      final String transactionId, final String statement, final List<ValueHolder> parameters) {
    return send(
            SendCommandRequest.builder()
                .sessionToken(token)
                .executeStatement(
                    ExecuteStatementRequest.builder()
                        .transactionId(transactionId)
                        .statement(statement)
                        .parameters(parameters)
                        .build())
                .build())
        .executeStatement();
  }

  FetchPageResult fetchPage(final String transactionId, final String nextPageToken) {
    return send(
            SendCommandRequest.builder()
                .sessionToken(token)
                .fetchPage(
                    FetchPageRequest.builder()
                        .transactionId(transactionId)
                        .nextPageToken(nextPageToken)
                        .build())
                .build())
        .fetchPage();
  }

  CommitTransactionResult commitTransaction(final String transactionId, final byte[] digest) {
    return send(
            SendCommandRequest.builder()
                .sessionToken(token)
                .commitTransaction(
                    CommitTransactionRequest.builder()
                        .transactionId(transactionId)
                        .commitDigest(SdkBytes.fromByteArray(digest))
                        .build())
                .build())
        .commitTransaction();
  }

  void abortTransaction() {
    send(
        SendCommandRequest.builder()
            .sessionToken(token)
            .abortTransaction(AbortTransactionRequest.builder().build())
            .build());
  }

  void endSession() {
    send(
        SendCommandRequest.builder()
            .sessionToken(token)
            .endSession(EndSessionRequest.builder().build())
            .build());
  }

  /** Ends the session, logging failures; the ledger cleans abandoned sessions up after a timeout. */
  void close() {
    try {
      endSession();
    } catch (final SdkException e) {
      LOGGER.log(WARNING, "Errors closing session " + id, e);
    }
  }

  private SendCommandResponse send(final SendCommandRequest request) {
    LOGGER.log(DEBUG, "Sending request: {0}", request);
    final var response = client.sendCommand(request);
    LOGGER.log(DEBUG, "Received response: {0}", response);
    return response;
  }
}
