package org.dballot.web;

import org.dballot.governance.Ballot;
import org.dballot.governance.BallotError;
import org.dballot.governance.BallotException;
import org.dballot.governance.BallotTally;
import org.dballot.identity.Identity;
import org.dballot.ledger.VotingRecord;
import org.dballot.proposal.Proposal;
import spark.Request;
import spark.Response;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP handlers for the ballot. The Spark-facing methods authenticate and parse;
 * the identity-taking overloads hold the logic.
 */
public class BallotHandler {

    private final Ballot ballot;
    private final RequestAuthenticator authenticator;

    public BallotHandler(Ballot ballot, RequestAuthenticator authenticator) {
        this.ballot = ballot;
        this.authenticator = authenticator;
    }

    // ================================
    // Public reads
    // ================================
    public Object listProposals(Request req, Response res) {
        return listProposals();
    }

    public Object proposal(Request req, Response res) {
        return proposal(parseIndex(req.params(":index")));
    }

    public Object winner(Request req, Response res) {
        return winner();
    }

    public Object tally(Request req, Response res) {
        return tally();
    }

    public Map<String, Object> listProposals() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Proposal p : ballot.proposals())
            out.add(describe(p));
        return Map.of("proposals", out);
    }

    public Map<String, Object> proposal(int index) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("index", index);
        out.put("name", ballot.getProposalName(index));
        out.put("voteCount", ballot.getProposalVote(index));
        return out;
    }

    public Map<String, Object> winner() {
        return Map.of(
                "winningProposal", ballot.winningProposal(),
                "winnerName", ballot.winnerName());
    }

    public Map<String, Object> tally() {
        BallotTally tally = ballot.tally();
        List<Map<String, Object>> proposals = new ArrayList<>();
        for (Proposal p : tally.getProposals())
            proposals.add(describe(p));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("proposals", proposals);
        out.put("winningProposal", tally.getWinningProposal());
        out.put("winnerName", tally.getWinnerName());
        out.put("totalGranted", tally.getTotalGranted());
        out.put("restingWeight", tally.getRestingWeight());
        out.put("countedWeight", tally.getCountedWeight());
        return out;
    }

    // ================================
    // Signed operations
    // ================================
    public Object grantRights(Request req, Response res) {
        return grantRights(authenticator.authenticate(req), req.body());
    }

    public Object delegate(Request req, Response res) {
        return delegate(authenticator.authenticate(req), req.body());
    }

    public Object vote(Request req, Response res) {
        return vote(authenticator.authenticate(req), req.body());
    }

    public Object hasVoted(Request req, Response res) {
        return hasVoted(authenticator.authenticate(req));
    }

    public Object voterInfo(Request req, Response res) {
        return voterInfo(authenticator.authenticate(req), req.queryParams("identity"));
    }

    public Map<String, Object> grantRights(Identity caller, String body) {
        Identity target = target(Json.body(body, TargetRequest.class));
        ballot.grantRights(caller, target);
        return ok("Voting rights granted");
    }

    public Map<String, Object> delegate(Identity caller, String body) {
        Identity target = target(Json.body(body, TargetRequest.class));
        ballot.delegate(caller, target);
        return ok("Delegated");
    }

    public Map<String, Object> vote(Identity caller, String body) {
        VoteRequest request = Json.body(body, VoteRequest.class);
        if (request.proposal == null)
            throw new BallotException(BallotError.INVALID_INPUT, "proposal is required");
        ballot.vote(caller, request.proposal);
        return ok("Vote recorded");
    }

    public Map<String, Object> hasVoted(Identity caller) {
        return Map.of("voted", ballot.hasVoted(caller));
    }

    public Map<String, Object> voterInfo(Identity caller, String identity) {
        if (identity == null || identity.isBlank())
            throw new BallotException(BallotError.INVALID_INPUT, "identity is required");
        VotingRecord record = ballot.getVoterInfo(caller, Identity.of(identity));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("identity", identity);
        out.put("weight", record.getWeight());
        out.put("voted", record.hasVoted());
        out.put("status", record.status().toString());
        if (record.getDelegateTarget() != null)
            out.put("delegate", record.getDelegateTarget().value());
        if (record.getChosenProposal() != null)
            out.put("vote", record.getChosenProposal());
        return out;
    }

    // ================================
    // Helpers
    // ================================
    private static Identity target(TargetRequest request) {
        if (request.target == null || request.target.isBlank())
            throw new BallotException(BallotError.INVALID_INPUT, "target is required");
        return Identity.of(request.target);
    }

    private static int parseIndex(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new BallotException(BallotError.INVALID_INPUT, "Proposal index must be an integer");
        }
    }

    private static Map<String, Object> describe(Proposal p) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("index", p.getIndex());
        out.put("name", p.getName());
        out.put("voteCount", p.getVoteCount());
        return out;
    }

    private Map<String, Object> ok(String msg) {
        return Map.of("status", "ok", "message", msg);
    }

    static class TargetRequest {
        String target;
    }

    static class VoteRequest {
        Integer proposal;
    }
}
