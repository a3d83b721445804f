package com.esgledger.governance;

import com.esgledger.common.exception.AlreadyExecutedException;
import com.esgledger.common.exception.ExpiredException;
import com.esgledger.common.exception.InvalidAmountException;
import com.esgledger.common.exception.InvalidStateException;
import com.esgledger.common.exception.QuorumNotMetException;
import com.esgledger.common.exception.RecordNotFoundException;
import com.esgledger.common.exception.UnauthorizedException;
import com.esgledger.ledger.AuthorizationToken;
import com.esgledger.ledger.GrantAction;
import com.esgledger.ledger.GrantIssuer;
import com.esgledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Committee proposal workflow gating privileged ledger operations.
 *
 * Proposal flow:
 * 1. A committee member proposes (one implicit vote)
 * 2. Members vote; each approving vote adds one
 * 3. Once the vote count reaches the required approvals, anyone may execute
 * 4. Execution issues a ledger grant for the proposal's action
 *
 * Votes are not deduplicated: a member voting twice is counted twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GovernanceService {

    private final ProposalRepository proposalRepository;
    private final CommitteeMemberRepository memberRepository;
    private final GovernanceSettingsRepository settingsRepository;
    private final ProposalPayloads payloads;
    private final LedgerService ledgerService;

    @Value("${esg-ledger.governance.required-approvals:3}")
    private int defaultRequiredApprovals;

    @Value("${esg-ledger.governance.proposal-ttl:P7D}")
    private Duration proposalTtl;

    @Transactional
    public CommitteeMember addMember(String callerId, String memberId) {
        ledgerService.requireAdmin(callerId, "add committee member");
        if (memberRepository.existsById(memberId)) {
            throw new InvalidStateException("Already a committee member: " + memberId);
        }
        CommitteeMember member = memberRepository.save(new CommitteeMember(memberId, callerId));
        log.info("Added committee member {}", memberId);
        return member;
    }

    @Transactional
    public void removeMember(String callerId, String memberId) {
        ledgerService.requireAdmin(callerId, "remove committee member");
        CommitteeMember member = memberRepository.findById(memberId)
            .orElseThrow(() -> new RecordNotFoundException("Committee member", memberId));
        memberRepository.delete(member);
        log.info("Removed committee member {}", memberId);
    }

    /**
     * Create a proposal expiring one proposal lifetime after {@code now}.
     */
    @Transactional
    public Proposal propose(String callerId, String proposalId, ProposalType type,
                            String payload, Instant now) {
        requireMember(callerId, "propose");
        if (proposalRepository.existsById(proposalId)) {
            throw new InvalidStateException("Proposal already exists: " + proposalId);
        }
        payloads.validate(type, payload);

        Proposal proposal = proposalRepository.save(
            new Proposal(proposalId, callerId, type, payload, now, now.plus(proposalTtl)));

        log.info("Proposal {} ({}) created by {}, expires {}",
            proposalId, type, callerId, proposal.getExpiresAt());

        return proposal;
    }

    /**
     * Cast a vote. Only approving votes change the count.
     *
     * @throws AlreadyExecutedException if the proposal was executed
     * @throws ExpiredException if {@code now} is at or past the expiry
     */
    @Transactional
    public Proposal vote(String callerId, String proposalId, boolean approve, Instant now) {
        requireMember(callerId, "vote");
        Proposal proposal = getProposal(proposalId);

        if (proposal.isExecuted()) {
            throw new AlreadyExecutedException(proposalId);
        }
        if (proposal.isExpired(now)) {
            throw new ExpiredException("Proposal", proposalId, proposal.getExpiresAt());
        }

        if (approve) {
            proposal.recordApproval();
            proposalRepository.save(proposal);
        }

        log.info("Vote on proposal {} by {}: approve={}, votes={}",
            proposalId, callerId, approve, proposal.getVoteCount());

        return proposal;
    }

    /**
     * Execute a proposal that reached quorum before expiring.
     *
     * @throws AlreadyExecutedException if the proposal was executed
     * @throws ExpiredException if {@code now} is at or past the expiry
     * @throws QuorumNotMetException if the vote count is below the required approvals
     */
    @Transactional
    public ProposalExecution execute(String callerId, String proposalId, Instant now) {
        Proposal proposal = getProposal(proposalId);

        if (proposal.isExecuted()) {
            throw new AlreadyExecutedException(proposalId);
        }
        if (proposal.isExpired(now)) {
            throw new ExpiredException("Proposal", proposalId, proposal.getExpiresAt());
        }
        int required = getRequiredApprovals();
        if (proposal.getVoteCount() < required) {
            throw new QuorumNotMetException(proposalId, proposal.getVoteCount(), required);
        }

        String account = requireEffectTarget(proposal);

        proposal.markExecuted(callerId, now);
        AuthorizationToken grant = applyEffect(proposal, account);
        if (grant != null) {
            proposal.attachGrant(grant.getGrantId());
        }
        proposalRepository.save(proposal);

        log.info("Proposal {} ({}) executed by {} with {} of {} approvals",
            proposalId, proposal.getProposalType(), callerId, proposal.getVoteCount(), required);

        AuthorizationToken returned = proposal.getProposalType() == ProposalType.MINT ? grant : null;
        return new ProposalExecution(proposalId, proposal.getProposalType(), returned);
    }

    @Transactional
    public void setRequiredApprovals(String callerId, int requiredApprovals) {
        ledgerService.requireAdmin(callerId, "set required approvals");
        if (requiredApprovals < 1) {
            throw new InvalidAmountException("Required approvals must be at least 1, was " + requiredApprovals);
        }
        GovernanceSettings settings = loadSettingsForUpdate();
        settings.changeRequiredApprovals(requiredApprovals);
        settingsRepository.save(settings);
        log.info("Required approvals set to {}", requiredApprovals);
    }

    @Transactional(readOnly = true)
    public int getRequiredApprovals() {
        return settingsRepository.findById(GovernanceSettings.SINGLETON_ID)
            .map(GovernanceSettings::getRequiredApprovals)
            .orElse(defaultRequiredApprovals);
    }

    @Transactional(readOnly = true)
    public Proposal getProposal(String proposalId) {
        return proposalRepository.findById(proposalId)
            .orElseThrow(() -> new RecordNotFoundException("Proposal", proposalId));
    }

    @Transactional(readOnly = true)
    public List<Proposal> getOpenProposals() {
        return proposalRepository.findByExecutedFalseOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public List<CommitteeMember> getMembers() {
        return memberRepository.findAll();
    }

    @Transactional(readOnly = true)
    public boolean isMember(String memberId) {
        return memberId != null && memberRepository.existsById(memberId);
    }

    /**
     * Resolve the account a freeze proposal targets before anything is marked.
     */
    private String requireEffectTarget(Proposal proposal) {
        ProposalType type = proposal.getProposalType();
        if (type != ProposalType.FREEZE && type != ProposalType.UNFREEZE) {
            return null;
        }
        String account = payloads.account(proposal.getPayload()).getAccount();
        ledgerService.getAccount(account);
        return account;
    }

    /**
     * Issue the proposal's grant. The proposal must already be marked executed,
     * since the ledger only accepts governance grants backed by an executed proposal.
     */
    private AuthorizationToken applyEffect(Proposal proposal, String account) {
        String proposalId = proposal.getProposalId();
        return switch (proposal.getProposalType()) {
            case MINT -> {
                ProposalPayloads.MintPayload mint = payloads.mint(proposal.getPayload());
                yield ledgerService.issueGrant(GrantIssuer.GOVERNANCE, GrantAction.MINT,
                    mint.getRecipient(), mint.getAmount(), proposalId);
            }
            case PAUSE -> applyNow(GrantAction.PAUSE, null, proposalId);
            case UNPAUSE -> applyNow(GrantAction.UNPAUSE, null, proposalId);
            case FREEZE -> applyNow(GrantAction.FREEZE, account, proposalId);
            case UNFREEZE -> applyNow(GrantAction.UNFREEZE, account, proposalId);
            case TEXT -> null;
        };
    }

    private AuthorizationToken applyNow(GrantAction action, String accountId, String proposalId) {
        AuthorizationToken token = ledgerService.issueGrant(GrantIssuer.GOVERNANCE, action, accountId, 0L, proposalId);
        ledgerService.applyGovernanceAction(token);
        return token;
    }

    private void requireMember(String callerId, String operation) {
        if (!isMember(callerId)) {
            throw new UnauthorizedException(callerId, operation);
        }
    }

    private GovernanceSettings loadSettingsForUpdate() {
        return settingsRepository.findById(GovernanceSettings.SINGLETON_ID)
            .orElseGet(() -> settingsRepository.save(new GovernanceSettings(defaultRequiredApprovals)));
    }
}
